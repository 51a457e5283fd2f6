package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.payment.PaymentMethodInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpRequestDecorator;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Reads a payment intent body once, keeps the bytes and hands the handler a request that
 * replays them. Bodies larger than {@code maxBytes} are not buffered and come back flagged as
 * oversized.
 */
@Slf4j
public class PaymentRequestBodyReader {

    private final ObjectMapper objectMapper;
    private final int maxBytes;

    public PaymentRequestBodyReader(ObjectMapper objectMapper, int maxBytes) {
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.objectMapper = objectMapper;
        this.maxBytes = maxBytes;
    }

    public int getMaxBytes() {
        return maxBytes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentIntentPayload(@JsonProperty("amount") BigDecimal amount,
                                       @JsonProperty("payment_method") PaymentMethodInfo paymentMethod) {
    }

    public record CachedRequest(ServerWebExchange exchange, Optional<PaymentIntentPayload> payload,
                                boolean oversized) {

        static CachedRequest oversized(ServerWebExchange exchange) {
            return new CachedRequest(exchange, Optional.empty(), true);
        }
    }

    public Mono<CachedRequest> read(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        long declared = request.getHeaders().getContentLength();
        if (declared > maxBytes) {
            log.warn("PAYMENT_BODY_TOO_LARGE: path={}, contentLength={}, limit={}",
                    request.getPath().value(), declared, maxBytes);
            return Mono.just(CachedRequest.oversized(exchange));
        }
        return DataBufferUtils.join(request.getBody(), maxBytes)
                .map(dataBuffer -> {
                    byte[] bytes = new byte[dataBuffer.readableByteCount()];
                    dataBuffer.read(bytes);
                    DataBufferUtils.release(dataBuffer);

                    ServerHttpRequest replaying = new ServerHttpRequestDecorator(request) {
                        @Override
                        public Flux<DataBuffer> getBody() {
                            return Flux.defer(() -> Flux.just(exchange.getResponse().bufferFactory().wrap(bytes)));
                        }
                    };
                    return new CachedRequest(exchange.mutate().request(replaying).build(), parse(bytes), false);
                })
                .defaultIfEmpty(new CachedRequest(exchange, Optional.empty(), false))
                .onErrorResume(DataBufferLimitException.class, e -> {
                    log.warn("PAYMENT_BODY_TOO_LARGE: path={}, limit={}, error={}",
                            request.getPath().value(), maxBytes, e.getMessage());
                    return Mono.just(CachedRequest.oversized(exchange));
                });
    }

    private Optional<PaymentIntentPayload> parse(byte[] bytes) {
        try {
            PaymentIntentPayload payload = objectMapper.readValue(bytes, PaymentIntentPayload.class);
            if (payload == null || payload.amount() == null || payload.amount().signum() <= 0) {
                log.debug("Payment intent body has no usable amount; skipping classification");
                return Optional.empty();
            }
            return Optional.of(payload);
        } catch (IOException e) {
            log.debug("Payment intent body is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
