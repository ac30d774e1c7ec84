package com.github.dimitryivaniuta.eventreg.server.token;

import java.time.Instant;

/**
 * Identity assertions carried by a token.
 *
 * @param issuer    {@code iss}
 * @param subject   {@code sub}, the user id
 * @param audience  {@code aud}
 * @param issuedAt  {@code iat}, second precision
 * @param expiresAt {@code exp}, second precision, always after {@code issuedAt}
 */
public record Claims(
        String issuer,
        String subject,
        Audience audience,
        Instant issuedAt,
        Instant expiresAt
) {
}
