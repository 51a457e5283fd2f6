package com.bookedbarber.ratelimit.web;

import com.bookedbarber.ratelimit.exception.PaymentViolationException;
import com.bookedbarber.ratelimit.exception.RateLimitExceededException;
import com.bookedbarber.ratelimit.gate.RateLimitErrorResponse;
import com.bookedbarber.ratelimit.gate.RateLimitHeaders;
import com.bookedbarber.ratelimit.payment.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for rate limit denials raised by the controller layer
 */
@Slf4j
@RestControllerAdvice
public class RateLimitExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<RateLimitErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.set(RateLimitHeaders.LIMIT, String.valueOf(ex.getLimit()));
        headers.set(RateLimitHeaders.REMAINING, "0");
        headers.set(RateLimitHeaders.RESET, String.valueOf(ex.getResetTime().getEpochSecond()));
        headers.set(RateLimitHeaders.TIER, ex.getTier());
        RateLimitHeaders.retryAfter(headers, ex.getRetryAfterSeconds());

        RateLimitErrorResponse body = RateLimitErrorResponse.of(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(),
                new RateLimitErrorResponse.Details(ex.getLimit(), ex.getWindowSeconds(), ex.getCurrentUsage(),
                        ex.getResetTime(), ex.getTier(), ex.getRetryAfterSeconds(), null));
        return new ResponseEntity<>(body, headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(PaymentViolationException.class)
    public ResponseEntity<RateLimitErrorResponse> handlePaymentViolation(PaymentViolationException ex) {
        Violation violation = ex.getViolation();
        HttpStatus status = violation.type().getStatus();
        log.warn("Payment violation: type={}, subject={}", violation.type().code(),
                violation.identity().subjectKey());

        HttpHeaders headers = new HttpHeaders();
        RateLimitHeaders.retryAfter(headers, ex.getRetryAfterSeconds());

        RateLimitErrorResponse body = RateLimitErrorResponse.of(status, violation.message(),
                new RateLimitErrorResponse.Details(numeric(violation, "limit"), numeric(violation, "window_seconds"),
                        numeric(violation, "attempts"),
                        violation.timestamp().plusSeconds(ex.getRetryAfterSeconds()), ex.getTier(),
                        ex.getRetryAfterSeconds(), violation.type().code()));
        return new ResponseEntity<>(body, headers, status);
    }

    @ExceptionHandler({IllegalArgumentException.class, WebExchangeBindException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(Exception ex) {
        String message = ex instanceof WebExchangeBindException bind
                ? bind.getFieldErrors().stream()
                        .map(error -> error.getField() + ": " + error.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Invalid request")
                : ex.getMessage();
        log.debug("Rejected invalid request: {}", message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "invalid_request");
        body.put("message", message);
        return ResponseEntity.badRequest().body(body);
    }

    private static long numeric(Violation violation, String key) {
        Object value = violation.context().get(key);
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
