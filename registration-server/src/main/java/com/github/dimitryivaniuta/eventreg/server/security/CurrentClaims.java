package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import reactor.core.publisher.Mono;

/**
 * Resolves the validated claims of the current request from the reactive security context.
 */
public final class CurrentClaims {

    private CurrentClaims() {
    }

    /**
     * @return claims stored by the authentication filter; {@link UnauthenticatedException} when
     *         the request was not authenticated with a token
     */
    public static Mono<Claims> get() {
        return ReactiveSecurityContextHolder.getContext()
                .mapNotNull(sc -> {
                    final Authentication auth = sc.getAuthentication();
                    return auth instanceof ClaimsAuthenticationToken token && token.isAuthenticated()
                            ? token.getClaims()
                            : null;
                })
                .switchIfEmpty(Mono.error(UnauthenticatedException::new));
    }
}
