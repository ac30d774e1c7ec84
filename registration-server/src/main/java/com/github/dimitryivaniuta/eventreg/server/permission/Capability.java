package com.github.dimitryivaniuta.eventreg.server.permission;

import java.util.Objects;

/**
 * What an operation needs: an access level on a resource.
 *
 * <p>A capability either names its resource ({@code server}, {@code organization},
 * {@code event}) and is checked against the permissions table, or is row-scoped: the resource
 * is whatever row the surrounding query joins permissions on.</p>
 *
 * @param resourceType   kind of resource
 * @param access         required access
 * @param organizationId the organization, or the event's parent organization
 * @param eventId        the event for event capabilities
 * @param rowScoped      resource comes from the queried row rather than from the ids above
 */
public record Capability(ResourceType resourceType, Access access, String organizationId, String eventId,
                         boolean rowScoped) {

    public Capability {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(access, "access");
    }

    public static Capability server(final Access access) {
        return new Capability(ResourceType.SERVER, access, null, null, false);
    }

    public static Capability organization(final Access access, final String organizationId) {
        return new Capability(ResourceType.ORGANIZATION, access,
                Objects.requireNonNull(organizationId, "organizationId"), null, false);
    }

    /**
     * @param organizationId the event's parent organization, so organization roles apply too
     */
    public static Capability event(final Access access, final String organizationId, final String eventId) {
        return new Capability(ResourceType.EVENT, access,
                Objects.requireNonNull(organizationId, "organizationId"),
                Objects.requireNonNull(eventId, "eventId"), false);
    }

    public static Capability rowScoped(final ResourceType resourceType, final Access access) {
        return new Capability(resourceType, access, null, null, true);
    }
}
