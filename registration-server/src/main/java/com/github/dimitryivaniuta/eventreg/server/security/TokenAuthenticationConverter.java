package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.server.config.SecurityProperties;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Pulls the raw token out of the request using the configured transports, in order. No token
 * means no authentication attempt; the authorization rules then decide.
 */
@Component
public class TokenAuthenticationConverter implements ServerAuthenticationConverter {

    private final List<TokenTransport> transports;

    private final Map<TokenTransport, TokenExtractor> extractors = new EnumMap<>(TokenTransport.class);

    public TokenAuthenticationConverter(final SecurityProperties securityProperties,
                                        final List<TokenExtractor> extractors) {
        this.transports = List.copyOf(securityProperties.getTransports());
        extractors.forEach(e -> this.extractors.put(e.transport(), e));
        for (TokenTransport t : transports) {
            if (!this.extractors.containsKey(t)) {
                throw new IllegalStateException("No token extractor for transport " + t);
            }
        }
    }

    @Override
    public Mono<Authentication> convert(final ServerWebExchange exchange) {
        return Mono.defer(() -> {
            for (TokenTransport t : transports) {
                final Optional<String> token = extractors.get(t).extract(exchange.getRequest());
                if (token.isPresent()) {
                    return Mono.just(ClaimsAuthenticationToken.unauthenticated(token.get()));
                }
            }
            return Mono.empty();
        });
    }
}
