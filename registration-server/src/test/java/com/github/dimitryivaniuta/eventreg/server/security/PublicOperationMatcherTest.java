package com.github.dimitryivaniuta.eventreg.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

class PublicOperationMatcherTest {

    private final PublicOperationMatcher matcher = new PublicOperationMatcher(List.of(
            "POST /auth/login",
            "GET /.well-known/**",
            "/status"));

    @Test
    void exactEntryMatchesOnlyThatPathAndMethod() {
        assertThat(matcher.matches(MockServerHttpRequest.post("/auth/login").build())).isTrue();
        assertThat(matcher.matches(MockServerHttpRequest.get("/auth/login").build())).isFalse();
        assertThat(matcher.matches(MockServerHttpRequest.post("/auth/login/extra").build())).isFalse();
        assertThat(matcher.matches(MockServerHttpRequest.post("/auth/claims").build())).isFalse();
    }

    @Test
    void prefixEntryMatchesEverythingBelow() {
        assertThat(matcher.matches(MockServerHttpRequest.get("/.well-known/jwks.json").build())).isTrue();
        assertThat(matcher.matches(MockServerHttpRequest.get("/.well-known").build())).isTrue();
        assertThat(matcher.matches(MockServerHttpRequest.get("/.well-knownx").build())).isFalse();
        assertThat(matcher.matches(MockServerHttpRequest.post("/.well-known/jwks.json").build())).isFalse();
    }

    @Test
    void entryWithoutMethodMatchesAnyMethod() {
        assertThat(matcher.matches(MockServerHttpRequest.get("/status").build())).isTrue();
        assertThat(matcher.matches(MockServerHttpRequest.delete("/status").build())).isTrue();
    }

    @Test
    void exchangeMatchingReportsResult() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/organizations"));

        StepVerifier.create(matcher.matches(exchange))
                .assertNext(result -> assertThat(result.isMatch()).isFalse())
                .verifyComplete();
    }
}
