package com.github.dimitryivaniuta.eventreg.common.error;

/**
 * Transport, transaction or row-mapping failure against persistence.
 * Surfaced to clients as a generic internal error; the cause is only logged.
 */
public class StoreException extends RegistrationException {

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StoreException(final String message) {
        super(message);
    }

    @Override
    public String code() {
        return "internal";
    }
}
