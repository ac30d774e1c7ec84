package com.github.dimitryivaniuta.eventreg.common.error;

/**
 * Base type of every failure the platform reports across a service boundary.
 *
 * <p>Subclasses map one-to-one onto the externally visible error kinds; the HTTP layer
 * translates them into status codes and a generic {@code ApiError} body.</p>
 */
public abstract class RegistrationException extends RuntimeException {

    protected RegistrationException(final String message) {
        super(message);
    }

    protected RegistrationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code (e.g. {@code unauthenticated}). */
    public abstract String code();
}
