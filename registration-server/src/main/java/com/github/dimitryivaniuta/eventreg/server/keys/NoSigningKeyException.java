package com.github.dimitryivaniuta.eventreg.server.keys;

import com.github.dimitryivaniuta.eventreg.common.error.RegistrationException;

/**
 * No usable signing key exists. Operational failure: an operator has to rotate keys.
 */
public class NoSigningKeyException extends RegistrationException {

    public NoSigningKeyException(final String message) {
        super(message);
    }

    @Override
    public String code() {
        return "internal";
    }
}
