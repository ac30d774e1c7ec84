package com.github.dimitryivaniuta.eventreg.server.organization;

/**
 * An organization hosting events.
 *
 * @param id   organization id; empty on create
 * @param name display name
 */
public record Organization(String id, String name) {

    public boolean isNew() {
        return id == null || id.isEmpty();
    }

    public Organization withId(final String newId) {
        return new Organization(newId, name);
    }
}
