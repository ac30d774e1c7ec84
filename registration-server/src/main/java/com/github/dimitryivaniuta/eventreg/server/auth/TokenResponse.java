package com.github.dimitryivaniuta.eventreg.server.auth;

import com.github.dimitryivaniuta.eventreg.server.token.Claims;

/**
 * Login result. The token is also set as a cookie.
 *
 * @param accessToken compact JWS
 * @param tokenType   always {@code Bearer}
 * @param expiresIn   seconds until expiry
 * @param claims      claims carried by the token
 */
public record TokenResponse(String accessToken, String tokenType, long expiresIn, Claims claims) {
}
