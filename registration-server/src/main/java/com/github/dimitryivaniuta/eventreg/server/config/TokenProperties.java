package com.github.dimitryivaniuta.eventreg.server.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token issuing settings.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "registration.token")
public class TokenProperties {

    /** Issuer value stamped into every token and required on validation. */
    @NotBlank
    private String issuer = "https://auth.example.com";

    /** Access token lifetime (six months by default). */
    @NotNull
    private Duration accessTokenTtl = Duration.ofDays(180);
}
