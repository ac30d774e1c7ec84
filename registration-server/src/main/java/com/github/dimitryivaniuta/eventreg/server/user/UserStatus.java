package com.github.dimitryivaniuta.eventreg.server.user;

/**
 * Account status, stored by name in {@code users.status}.
 */
public enum UserStatus {
    /** Allowed to log in and call APIs. */
    ACTIVE,

    /** Temporarily suspended by an administrator; cannot log in. */
    SUSPENDED,

    /** Created but not yet activated. */
    PENDING;

    /**
     * Resolves a stored value.
     *
     * @param value column value
     * @return matching status or {@link #PENDING} as a conservative default
     */
    public static UserStatus fromDbValue(final String value) {
        if (value == null) return PENDING;
        for (UserStatus s : values()) {
            if (s.name().equals(value)) return s;
        }
        return PENDING;
    }
}
