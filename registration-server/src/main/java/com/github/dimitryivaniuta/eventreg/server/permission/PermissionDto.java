package com.github.dimitryivaniuta.eventreg.server.permission;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;

/**
 * Wire shape of a permission: the role's resource is flattened into
 * {@code organizationId}/{@code eventId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionDto(String id, String userId, String role, String organizationId, String eventId) {

    public static PermissionDto from(final Permission permission) {
        final Role role = permission.role();
        return new PermissionDto(permission.id(), permission.userId(), role.type().name(),
                role.organizationId(), role.eventId());
    }

    /**
     * @throws ValidationException with a path relative to this item
     */
    public Permission toPermission() {
        if (userId == null || userId.isBlank()) {
            throw ValidationException.empty("userId");
        }
        if (role == null || role.isBlank()) {
            throw ValidationException.empty("role");
        }
        final RoleType type = RoleType.from(role).orElseThrow(() -> ValidationException.invalidEnum("role"));
        final String resourceId = switch (type.getResourceType()) {
            case SERVER -> null;
            case ORGANIZATION -> organizationId;
            case EVENT -> eventId;
        };
        return new Permission(id == null ? "" : id, userId, new Role(type, resourceId));
    }
}
