package com.github.dimitryivaniuta.eventreg.common.error;

/** Identity is valid but lacks the permission required by the operation. */
public class ForbiddenException extends RegistrationException {

    public ForbiddenException() {
        super("forbidden");
    }

    @Override
    public String code() {
        return "forbidden";
    }
}
