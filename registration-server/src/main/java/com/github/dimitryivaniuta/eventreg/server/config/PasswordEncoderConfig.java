package com.github.dimitryivaniuta.eventreg.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Exposes the password encoder used to verify login credentials.
 */
@Configuration
public class PasswordEncoderConfig {

    /**
     * @return BCrypt encoder, strength 12
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }
}
