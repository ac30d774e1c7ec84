package com.github.dimitryivaniuta.eventreg.server.permission;

import java.util.Locale;
import java.util.Optional;
import lombok.Getter;

/** Closed set of grantable roles, each bound to one kind of resource. */
@Getter
public enum RoleType {
    SERVER_ADMIN(ResourceType.SERVER),
    ORGANIZATION_ADMIN(ResourceType.ORGANIZATION),
    ORGANIZATION_VIEWER(ResourceType.ORGANIZATION),
    EVENT_ADMIN(ResourceType.EVENT),
    EVENT_EDITOR(ResourceType.EVENT),
    EVENT_VIEWER(ResourceType.EVENT);

    /** Resource the role's parameter identifies. */
    private final ResourceType resourceType;

    RoleType(final ResourceType resourceType) {
        this.resourceType = resourceType;
    }

    public static Optional<RoleType> from(final String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
