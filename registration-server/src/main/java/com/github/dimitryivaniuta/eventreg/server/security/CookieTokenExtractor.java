package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.server.config.SecurityProperties;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/** Reads the token cookie set at login. */
@Component
@RequiredArgsConstructor
public class CookieTokenExtractor implements TokenExtractor {

    private final SecurityProperties securityProperties;

    @Override
    public TokenTransport transport() {
        return TokenTransport.COOKIE;
    }

    @Override
    public Optional<String> extract(final ServerHttpRequest request) {
        final HttpCookie cookie = request.getCookies().getFirst(securityProperties.getCookieName());
        if (cookie == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }
}
