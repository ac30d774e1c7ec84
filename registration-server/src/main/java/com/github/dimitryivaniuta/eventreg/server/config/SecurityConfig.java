package com.github.dimitryivaniuta.eventreg.server.config;

import com.github.dimitryivaniuta.eventreg.server.security.ClaimsAuthenticationManager;
import com.github.dimitryivaniuta.eventreg.server.security.JsonErrorWriter;
import com.github.dimitryivaniuta.eventreg.server.security.PublicOperationMatcher;
import com.github.dimitryivaniuta.eventreg.server.security.TokenAuthenticationConverter;
import com.github.dimitryivaniuta.eventreg.server.web.ApiError;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.AuthenticationServiceException;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.NegatedServerWebExchangeMatcher;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

/**
 * Reactive security configuration.
 * Every operation except the configured public ones needs a valid ACCESS token, taken from the
 * cookie or bearer header and validated by the token service. Nothing is kept between requests.
 */
@Slf4j
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JsonErrorWriter errorWriter;

    private final PublicOperationMatcher publicOperations;

    private final SecurityProperties securityProperties;

    @Bean
    public SecurityWebFilterChain springSecurityFilterChain(final ServerHttpSecurity http,
                                                            final ClaimsAuthenticationManager authenticationManager,
                                                            final TokenAuthenticationConverter converter) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(c -> c.configurationSource(corsConfigurationSource()))
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((exchange, e) -> errorWriter.unauthenticated(exchange))
                        .accessDeniedHandler((exchange, e) -> errorWriter.write(exchange,
                                HttpStatus.FORBIDDEN, ApiError.of("forbidden", "forbidden"))))
                .authorizeExchange(ex -> ex
                        .matchers(publicOperations).permitAll()
                        .anyExchange().authenticated())
                .addFilterAt(tokenAuthenticationFilter(authenticationManager, converter), SecurityWebFiltersOrder.AUTHENTICATION)
                .build();
    }

    /**
     * Validates the request's token and stores its claims in the security context. Public
     * operations are skipped, so a stale cookie never blocks login or logout. Must not be a bean:
     * WebFlux registers WebFilter beans globally, outside the security chain.
     */
    private AuthenticationWebFilter tokenAuthenticationFilter(final ClaimsAuthenticationManager authenticationManager,
                                                             final TokenAuthenticationConverter converter) {
        final AuthenticationWebFilter filter = new AuthenticationWebFilter(authenticationManager);
        filter.setServerAuthenticationConverter(converter);
        filter.setRequiresAuthenticationMatcher(new NegatedServerWebExchangeMatcher(publicOperations));
        filter.setSecurityContextRepository(NoOpServerSecurityContextRepository.getInstance());
        filter.setAuthenticationFailureHandler((webFilterExchange, e) -> {
            if (e instanceof AuthenticationServiceException) {
                return errorWriter.write(webFilterExchange.getExchange(), HttpStatus.INTERNAL_SERVER_ERROR,
                        ApiError.of("internal", "internal error"));
            }
            return errorWriter.unauthenticated(webFilterExchange.getExchange());
        });
        return filter;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        var cfg = new CorsConfiguration();
        cfg.setAllowedOrigins(securityProperties.getAllowedOrigins());
        cfg.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("X-Correlation-ID"));
        cfg.setAllowCredentials(false);
        cfg.setMaxAge(3600L);

        var source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
