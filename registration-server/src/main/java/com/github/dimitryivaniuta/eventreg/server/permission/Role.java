package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;

/**
 * A role with the id of the resource it applies to. {@code SERVER_ADMIN} has no resource; every
 * other role names exactly one organization or event.
 *
 * @param type       role variant
 * @param resourceId organization or event id, {@code null} for {@code SERVER_ADMIN}
 */
public record Role(RoleType type, String resourceId) {

    public Role {
        if (type == null) {
            throw ValidationException.empty("role");
        }
        if (type.getResourceType() == ResourceType.SERVER) {
            resourceId = null;
        } else if (resourceId == null || resourceId.isBlank()) {
            throw ValidationException.empty(type.getResourceType() == ResourceType.ORGANIZATION
                    ? "organizationId" : "eventId");
        }
    }

    public static Role serverAdmin() {
        return new Role(RoleType.SERVER_ADMIN, null);
    }

    public static Role of(final RoleType type, final String resourceId) {
        return new Role(type, resourceId);
    }

    /** Organization id for organization roles, otherwise {@code null}. */
    public String organizationId() {
        return type.getResourceType() == ResourceType.ORGANIZATION ? resourceId : null;
    }

    /** Event id for event roles, otherwise {@code null}. */
    public String eventId() {
        return type.getResourceType() == ResourceType.EVENT ? resourceId : null;
    }
}
