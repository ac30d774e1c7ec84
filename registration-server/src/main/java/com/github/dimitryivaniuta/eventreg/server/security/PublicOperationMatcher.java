package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.server.config.SecurityProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Matches operations that bypass authentication.
 *
 * <p>Entries read {@code [METHOD ]path}. A path ending in {@code /**} matches that prefix and
 * everything below it; any other path must match exactly. Without a method every method
 * matches.</p>
 */
@Slf4j
@Component
public class PublicOperationMatcher implements ServerWebExchangeMatcher {

    private final List<Entry> entries;

    public PublicOperationMatcher(final SecurityProperties securityProperties) {
        this(securityProperties.getPublicOperations());
    }

    PublicOperationMatcher(final List<String> operations) {
        final List<Entry> parsed = new ArrayList<>(operations.size());
        for (String op : operations) {
            parsed.add(Entry.parse(op));
        }
        this.entries = List.copyOf(parsed);
        log.info("Public operations: {}", operations);
    }

    @Override
    public Mono<MatchResult> matches(final ServerWebExchange exchange) {
        return matches(exchange.getRequest()) ? MatchResult.match() : MatchResult.notMatch();
    }

    boolean matches(final ServerHttpRequest request) {
        final String path = request.getPath().pathWithinApplication().value();
        for (Entry e : entries) {
            if (e.matches(request.getMethod(), path)) {
                return true;
            }
        }
        return false;
    }

    private record Entry(HttpMethod method, String path, boolean prefix) {

        static Entry parse(final String raw) {
            final String value = raw.trim();
            final int space = value.indexOf(' ');
            HttpMethod method = null;
            String path = value;
            if (space > 0) {
                method = HttpMethod.valueOf(value.substring(0, space).toUpperCase(Locale.ROOT));
                path = value.substring(space + 1).trim();
            }
            if (path.endsWith("/**")) {
                return new Entry(method, path.substring(0, path.length() - 3), true);
            }
            return new Entry(method, path, false);
        }

        boolean matches(final HttpMethod requestMethod, final String requestPath) {
            if (method != null && !method.equals(requestMethod)) {
                return false;
            }
            if (!prefix) {
                return path.equals(requestPath);
            }
            return requestPath.equals(path) || requestPath.startsWith(path + "/");
        }
    }
}
