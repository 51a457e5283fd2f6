package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which requests are gated and which of those are payment actions.
 */
public class ProtectedPathMatcher {

    private static final String INTENT_ID = "intentId";

    private final AntPathMatcher antPathMatcher = new AntPathMatcher();
    private final List<String> protectedPaths;
    private final List<String> paymentIntentPaths;
    private final List<String> paymentConfirmationPaths;

    public ProtectedPathMatcher(RateLimitProperties properties) {
        this.protectedPaths = List.copyOf(properties.getProtectedPaths());
        this.paymentIntentPaths = List.copyOf(properties.getPaymentIntentPaths());
        this.paymentConfirmationPaths = List.copyOf(properties.getPaymentConfirmationPaths());
    }

    public boolean isProtected(String path) {
        return protectedPaths.stream().anyMatch(path::startsWith);
    }

    /**
     * Payment actions use the payment failure policy; everything else uses the api one.
     */
    public boolean isPaymentAction(HttpMethod method, String path) {
        return isPaymentIntent(method, path) || paymentIntentId(method, path).isPresent();
    }

    public boolean isPaymentIntent(HttpMethod method, String path) {
        return HttpMethod.POST.equals(method)
                && paymentIntentPaths.stream().anyMatch(pattern -> antPathMatcher.match(pattern, path));
    }

    /**
     * Intent id of a payment confirmation request, empty for anything else.
     */
    public Optional<String> paymentIntentId(HttpMethod method, String path) {
        if (!HttpMethod.POST.equals(method)) {
            return Optional.empty();
        }
        for (String pattern : paymentConfirmationPaths) {
            if (antPathMatcher.match(pattern, path)) {
                Map<String, String> variables = antPathMatcher.extractUriTemplateVariables(pattern, path);
                return Optional.ofNullable(variables.get(INTENT_ID));
            }
        }
        return Optional.empty();
    }
}
