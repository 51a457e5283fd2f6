package com.bookedbarber.ratelimit.identity;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Reads the API key and user id placed on the request by the edge authentication layer.
 *
 * The raw API key never leaves this class; counters are keyed by a truncated SHA-256 of it.
 * A user id header wins over the exchange principal.
 */
public class HeaderIdentityProvider implements IdentityProvider {

    private final RateLimitProperties.Identity config;

    public HeaderIdentityProvider(RateLimitProperties.Identity config) {
        this.config = config;
    }

    @Override
    public Mono<Identity> authenticate(ServerWebExchange exchange, String clientIp) {
        String apiKey = exchange.getRequest().getHeaders().getFirst(config.getApiKeyHeader());
        if (StringUtils.hasText(apiKey)) {
            return Mono.just(Identity.ofApiKey(apiKeyId(apiKey.trim()), clientIp));
        }
        String userId = exchange.getRequest().getHeaders().getFirst(config.getUserIdHeader());
        if (StringUtils.hasText(userId)) {
            return Mono.just(Identity.ofUser(userId.trim(), clientIp));
        }
        return exchange.getPrincipal()
                .filter(principal -> StringUtils.hasText(principal.getName()))
                .map(principal -> Identity.ofUser(principal.getName(), clientIp));
    }

    static String apiKeyId(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
