package com.github.dimitryivaniuta.eventreg.server.auth;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Login request payload.
 */
@Data
public final class LoginRequest {

    /** Account email, matched case-insensitively. */
    @NotBlank
    private String email;

    /** Password in clear; verified with BCrypt. */
    @NotBlank
    private String password;
}
