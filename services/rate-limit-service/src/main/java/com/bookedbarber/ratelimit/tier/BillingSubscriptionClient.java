package com.bookedbarber.ratelimit.tier;

import com.bookedbarber.ratelimit.identity.Identity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Subscription lookup against the billing service.
 *
 * {@code GET {base-url}/api/v2/billing/subscriptions/{subject}} answers {@code {"tier": "premium"}};
 * a 404 means the subject has no subscription.
 */
@Slf4j
public class BillingSubscriptionClient implements SubscriptionClient {

    private final WebClient webClient;
    private final Duration timeout;

    public BillingSubscriptionClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<TierName> findTier(Identity identity) {
        return webClient.get()
                .uri("/api/v2/billing/subscriptions/{subject}", identity.subjectKey())
                .retrieve()
                .bodyToMono(SubscriptionResponse.class)
                .timeout(timeout)
                .flatMap(response -> Mono.justOrEmpty(response.getTier()))
                .map(TierName::fromLabel)
                .onErrorResume(WebClientResponseException.class, e -> {
                    if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        log.debug("No subscription on record for subject={}", identity.subjectKey());
                        return Mono.empty();
                    }
                    return Mono.error(e);
                });
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SubscriptionResponse {
        private String tier;
    }
}
