package com.github.dimitryivaniuta.eventreg.server.event;

/**
 * An event run by an organization.
 *
 * @param id             event id; empty on create
 * @param organizationId owning organization
 * @param name           display name
 */
public record Event(String id, String organizationId, String name) {

    public boolean isNew() {
        return id == null || id.isEmpty();
    }

    public Event withId(final String newId) {
        return new Event(newId, organizationId, name);
    }
}
