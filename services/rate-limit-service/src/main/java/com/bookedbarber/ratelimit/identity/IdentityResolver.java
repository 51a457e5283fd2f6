package com.bookedbarber.ratelimit.identity;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Derives the rate limited subject for a request.
 *
 * Authentication failures and anonymous callers both fall back to the client IP identity,
 * so this never errors and never completes empty.
 */
@Slf4j
public class IdentityResolver {

    private final IdentityProvider identityProvider;
    private final RateLimitProperties.Identity config;

    public IdentityResolver(IdentityProvider identityProvider, RateLimitProperties.Identity config) {
        this.identityProvider = identityProvider;
        this.config = config;
    }

    public Mono<Identity> resolve(ServerWebExchange exchange) {
        String clientIp = clientIp(exchange.getRequest());
        return identityProvider.authenticate(exchange, clientIp)
                .onErrorResume(e -> {
                    log.warn("IDENTITY_RESOLUTION_FAILED: ip={}, error={} - treating as anonymous",
                            clientIp, e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(Identity.ofIp(clientIp));
    }

    /**
     * Two-letter country supplied by the edge geo lookup, upper-cased, or {@code null}.
     */
    public String country(ServerWebExchange exchange) {
        String country = exchange.getRequest().getHeaders().getFirst(config.getCountryHeader());
        return StringUtils.hasText(country) ? country.trim().toUpperCase(Locale.ROOT) : null;
    }

    String clientIp(ServerHttpRequest request) {
        if (config.isTrustForwardedFor()) {
            String xForwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
            if (StringUtils.hasText(xForwardedFor)) {
                return xForwardedFor.split(",")[0].trim();
            }
            String xRealIp = request.getHeaders().getFirst("X-Real-IP");
            if (StringUtils.hasText(xRealIp)) {
                return xRealIp.trim();
            }
        }
        return request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null
                ? request.getRemoteAddress().getAddress().getHostAddress()
                : "unknown";
    }
}
