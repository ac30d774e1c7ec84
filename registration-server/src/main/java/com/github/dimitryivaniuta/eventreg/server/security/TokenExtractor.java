package com.github.dimitryivaniuta.eventreg.server.security;

import java.util.Optional;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Reads the raw access token from one transport. Extractors never validate; every transport
 * feeds the same validation.
 */
public interface TokenExtractor {

    TokenTransport transport();

    Optional<String> extract(ServerHttpRequest request);
}
