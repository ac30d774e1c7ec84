package com.github.dimitryivaniuta.eventreg.common.error;

/**
 * Missing, malformed, expired or otherwise invalid credential.
 *
 * <p>Every token check collapses into this single type so callers cannot tell a bad
 * signature from an unknown key id.</p>
 */
public class UnauthenticatedException extends RegistrationException {

    public static final String DEFAULT_MESSAGE = "unauthenticated";

    public UnauthenticatedException() {
        super(DEFAULT_MESSAGE);
    }

    public UnauthenticatedException(final String message) {
        super(message);
    }

    @Override
    public String code() {
        return "unauthenticated";
    }
}
