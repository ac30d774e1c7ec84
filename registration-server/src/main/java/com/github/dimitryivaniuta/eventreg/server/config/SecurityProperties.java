package com.github.dimitryivaniuta.eventreg.server.config;

import com.github.dimitryivaniuta.eventreg.server.security.TokenTransport;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request authentication settings.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "registration.security")
public class SecurityProperties {

    /** Credential transports, tried in order. */
    @NotEmpty
    private List<TokenTransport> transports = new ArrayList<>(List.of(TokenTransport.COOKIE, TokenTransport.BEARER));

    /**
     * Operations reachable without a token, each {@code [METHOD ]path}. A trailing {@code /**}
     * matches by prefix.
     */
    private List<String> publicOperations = new ArrayList<>(List.of(
            "POST /auth/login",
            "POST /auth/logout",
            "GET /.well-known/**",
            "GET /actuator/health"));

    /** Name of the cookie carrying the access token. */
    @NotBlank
    private String cookieName = "authorization";

    /** Whether the login cookie carries the {@code Secure} attribute. */
    private boolean secureCookie = true;

    /** CORS origins allowed to call the API. */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
