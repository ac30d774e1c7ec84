package com.github.dimitryivaniuta.eventreg.server.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.eventreg.server.config.SecurityProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

class TokenAuthenticationConverterTest {

    private final SecurityProperties properties = new SecurityProperties();

    @Test
    void cookieWinsWhenListedFirst() {
        StepVerifier.create(converter().convert(exchangeWithBoth()))
                .assertNext(auth -> assertThat(auth.getCredentials()).isEqualTo("from-cookie"))
                .verifyComplete();
    }

    @Test
    void transportOrderIsConfigurable() {
        properties.setTransports(List.of(TokenTransport.BEARER, TokenTransport.COOKIE));

        StepVerifier.create(converter().convert(exchangeWithBoth()))
                .assertNext(auth -> assertThat(auth.getCredentials()).isEqualTo("from-header"))
                .verifyComplete();
    }

    @Test
    void disabledTransportIsIgnored() {
        properties.setTransports(List.of(TokenTransport.BEARER));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/auth/claims")
                .cookie(new HttpCookie("authorization", "from-cookie")));

        StepVerifier.create(converter().convert(exchange)).verifyComplete();
    }

    @Test
    void bearerPrefixIsCaseInsensitiveAndEmptyTokenIgnored() {
        BearerTokenExtractor bearer = new BearerTokenExtractor();

        assertThat(bearer.extract(MockServerHttpRequest.get("/")
                .header(HttpHeaders.AUTHORIZATION, "bearer abc").build())).contains("abc");
        assertThat(bearer.extract(MockServerHttpRequest.get("/")
                .header(HttpHeaders.AUTHORIZATION, "Bearer   ").build())).isEmpty();
        assertThat(bearer.extract(MockServerHttpRequest.get("/")
                .header(HttpHeaders.AUTHORIZATION, "Basic abc").build())).isEmpty();
    }

    @Test
    void noCredentialMeansNoAuthenticationAttempt() {
        StepVerifier.create(converter().convert(MockServerWebExchange.from(MockServerHttpRequest.get("/"))))
                .verifyComplete();
    }

    @Test
    void configuredTransportWithoutExtractorFailsFast() {
        assertThatThrownBy(() -> new TokenAuthenticationConverter(properties, List.of(new BearerTokenExtractor())))
                .isInstanceOf(IllegalStateException.class);
    }

    private TokenAuthenticationConverter converter() {
        return new TokenAuthenticationConverter(properties,
                List.of(new BearerTokenExtractor(), new CookieTokenExtractor(properties)));
    }

    private static MockServerWebExchange exchangeWithBoth() {
        return MockServerWebExchange.from(MockServerHttpRequest.get("/auth/claims")
                .cookie(new HttpCookie("authorization", "from-cookie"))
                .header(HttpHeaders.AUTHORIZATION, "Bearer from-header"));
    }
}
