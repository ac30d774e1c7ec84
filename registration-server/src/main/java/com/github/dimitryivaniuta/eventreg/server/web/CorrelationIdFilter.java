package com.github.dimitryivaniuta.eventreg.server.web;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Ensures every request carries a correlation id:
 * <ul>
 *   <li>Reads or creates {@code X-Correlation-ID}.</li>
 *   <li>Echoes it on the response.</li>
 *   <li>Exposes it as an exchange attribute for error logging.</li>
 * </ul>
 */
@Slf4j
@Component
public class CorrelationIdFilter implements WebFilter, Ordered {

    /** Exchange attribute key containing the correlation id. */
    public static final String ATTR_CORRELATION_ID = "com.github.dimitryivaniuta.eventreg.correlation-id";

    public static final String HEADER_CORRELATION_ID = "X-Correlation-ID";

    /** Longest accepted client-supplied id. */
    private static final int MAX_LENGTH = 200;

    @Override
    public Mono<Void> filter(final ServerWebExchange exchange, final WebFilterChain chain) {
        String id = normalize(exchange.getRequest().getHeaders().getFirst(HEADER_CORRELATION_ID));
        ServerWebExchange current = exchange;
        if (id == null) {
            id = UUID.randomUUID().toString();
            final String generated = id;
            final ServerHttpRequest mutated = exchange.getRequest()
                    .mutate()
                    .headers(h -> h.set(HEADER_CORRELATION_ID, generated))
                    .build();
            current = exchange.mutate().request(mutated).build();
            if (log.isDebugEnabled()) {
                log.debug("Generated new correlation id {}", generated);
            }
        }
        final String correlationId = id;
        current.getAttributes().put(ATTR_CORRELATION_ID, correlationId);
        current.getResponse().getHeaders().set(HEADER_CORRELATION_ID, correlationId);
        return chain.filter(current);
    }

    /** Runs before the security chain so rejected requests carry the id too. */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    private static String normalize(final String raw) {
        if (raw == null) return null;
        final String v = raw.trim();
        if (v.isEmpty() || v.length() > MAX_LENGTH) return null;
        return v;
    }
}
