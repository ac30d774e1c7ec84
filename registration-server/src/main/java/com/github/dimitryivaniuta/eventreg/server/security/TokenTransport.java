package com.github.dimitryivaniuta.eventreg.server.security;

/** Where a request may carry its access token. */
public enum TokenTransport {
    /** Cookie named by {@code registration.security.cookie-name}. */
    COOKIE,

    /** {@code Authorization: Bearer <token>} header. */
    BEARER
}
