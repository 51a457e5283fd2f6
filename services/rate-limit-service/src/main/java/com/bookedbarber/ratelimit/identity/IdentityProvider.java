package com.bookedbarber.ratelimit.identity;

import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Authentication collaborator. Empty means the caller is anonymous; errors are treated the same way.
 */
public interface IdentityProvider {

    Mono<Identity> authenticate(ServerWebExchange exchange, String clientIp);
}
