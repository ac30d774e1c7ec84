package com.github.dimitryivaniuta.eventreg.server.token;

import reactor.core.publisher.Mono;

/**
 * Issues and validates signed identity tokens.
 */
public interface TokenService {

    /**
     * Signs a new token for {@code subject} with the active key.
     *
     * @param subject  user id
     * @param audience intended use
     * @return serialized token and its claims
     */
    Mono<IssuedToken> issue(String subject, Audience audience);

    /**
     * Verifies {@code token} and returns its claims.
     *
     * <p>Any defect (malformed, unknown or expired key, bad signature, wrong issuer or
     * audience, outside its validity window) fails with the same
     * {@code UnauthenticatedException}. Storage failures surface as {@code StoreException}.</p>
     *
     * @param token            compact JWS
     * @param expectedAudience audience the caller requires
     */
    Mono<Claims> validate(String token, Audience expectedAudience);
}
