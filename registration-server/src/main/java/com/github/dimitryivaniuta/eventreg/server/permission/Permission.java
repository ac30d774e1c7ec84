package com.github.dimitryivaniuta.eventreg.server.permission;

/**
 * A role granted to a user.
 *
 * @param id     permission id; empty on create
 * @param userId grantee
 * @param role   granted role
 */
public record Permission(String id, String userId, Role role) {

    public boolean isNew() {
        return id == null || id.isEmpty();
    }

    public Permission withId(final String newId) {
        return new Permission(newId, userId, role);
    }
}
