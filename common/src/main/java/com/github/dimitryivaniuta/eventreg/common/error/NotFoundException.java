package com.github.dimitryivaniuta.eventreg.common.error;

import lombok.Getter;

/** A referenced entity id does not exist. */
@Getter
public class NotFoundException extends RegistrationException {

    /** The (first) id that could not be found. */
    private final String id;

    public NotFoundException(final String id) {
        super("id " + id + " does not exist");
        this.id = id;
    }

    @Override
    public String code() {
        return "not_found";
    }
}
