package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.server.token.Audience;
import com.github.dimitryivaniuta.eventreg.server.token.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationServiceException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Authenticates a {@link ClaimsAuthenticationToken} by validating its raw token as an ACCESS
 * token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimsAuthenticationManager implements ReactiveAuthenticationManager {

    private final TokenService tokenService;

    @Override
    public Mono<Authentication> authenticate(final Authentication authentication) {
        final Object credentials = authentication.getCredentials();
        if (!(credentials instanceof String token)) {
            return Mono.error(new BadCredentialsException(UnauthenticatedException.DEFAULT_MESSAGE));
        }
        return tokenService.validate(token, Audience.ACCESS)
                .<Authentication>map(ClaimsAuthenticationToken::authenticated)
                .onErrorMap(e -> {
                    if (e instanceof UnauthenticatedException) {
                        return new BadCredentialsException(UnauthenticatedException.DEFAULT_MESSAGE, e);
                    }
                    log.error("Token validation failed on the server side", e);
                    return new AuthenticationServiceException("token validation unavailable", e);
                });
    }
}
