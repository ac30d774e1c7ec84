package com.github.dimitryivaniuta.eventreg.server.security;

import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/** Reads {@code Authorization: Bearer <token>}. */
@Component
public class BearerTokenExtractor implements TokenExtractor {

    private static final String PREFIX = "Bearer ";

    @Override
    public TokenTransport transport() {
        return TokenTransport.BEARER;
    }

    @Override
    public Optional<String> extract(final ServerHttpRequest request) {
        final String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        final String token = header.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
