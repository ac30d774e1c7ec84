package com.github.dimitryivaniuta.eventreg.server.keys;

/**
 * Persisted state of a signing key. EXPIRED is never stored; it is derived from
 * {@code expires_at}.
 */
public enum KeyStatus {
    /** Signs new tokens and verifies existing ones. At most one key is ACTIVE. */
    ACTIVE,

    /** Verifies tokens it signed earlier until it expires. */
    RETIRED
}
