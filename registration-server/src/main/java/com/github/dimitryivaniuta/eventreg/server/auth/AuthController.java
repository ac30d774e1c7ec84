package com.github.dimitryivaniuta.eventreg.server.auth;

import com.github.dimitryivaniuta.eventreg.server.config.SecurityProperties;
import com.github.dimitryivaniuta.eventreg.server.security.CurrentClaims;
import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import com.github.dimitryivaniuta.eventreg.server.token.IssuedToken;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Login, logout and claims introspection.
 */
@Slf4j
@Validated
@RestController
@RequestMapping(path = "/auth", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    private final Clock clock;

    private final SecurityProperties securityProperties;

    /**
     * Verifies credentials and returns a signed access token, also set as an HttpOnly cookie.
     */
    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TokenResponse> login(@Valid @RequestBody final LoginRequest req, final ServerHttpResponse response) {
        return authService.login(req.getEmail(), req.getPassword())
                .map(issued -> {
                    final Duration ttl = Duration.between(clock.instant(), issued.claims().expiresAt());
                    response.addCookie(tokenCookie(issued.token(), ttl));
                    return toResponse(issued, ttl);
                });
    }

    /** Expires the token cookie. Tokens themselves stay valid until they expire. */
    @PostMapping(path = "/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> logout(final ServerHttpResponse response) {
        return Mono.fromRunnable(() -> response.addCookie(tokenCookie("", Duration.ZERO)));
    }

    @GetMapping(path = "/claims")
    public Mono<Claims> claims() {
        return CurrentClaims.get();
    }

    private ResponseCookie tokenCookie(final String value, final Duration maxAge) {
        return ResponseCookie.from(securityProperties.getCookieName(), value)
                .httpOnly(true)
                .secure(securityProperties.isSecureCookie())
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static TokenResponse toResponse(final IssuedToken issued, final Duration ttl) {
        return new TokenResponse(issued.token(), "Bearer", Math.max(0, ttl.toSeconds()), issued.claims());
    }
}
