package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a capability into a query predicate over permission rows.
 *
 * <p>The predicate is an OR with one alternative per role that satisfies the capability:
 * {@code grantee = subject AND role = R [AND resource = id]}. Anything not listed is denied.</p>
 *
 * <pre>
 * SERVER/*             SERVER_ADMIN
 * ORGANIZATION/ADMIN   + ORGANIZATION_ADMIN(org)
 * ORGANIZATION/EDIT    same as ADMIN
 * ORGANIZATION/READ    + ORGANIZATION_VIEWER(org)
 * EVENT/ADMIN          + EVENT_ADMIN(event), ORGANIZATION_ADMIN(parent)
 * EVENT/EDIT           + EVENT_EDITOR(event)
 * EVENT/READ           + EVENT_VIEWER(event), ORGANIZATION_VIEWER(parent)
 * </pre>
 */
public final class PermissionRules {

    private PermissionRules() {
    }

    /**
     * @param subject    user id from the validated claims
     * @param capability what the operation needs
     * @param columns    permission columns as fields of the queried entity
     * @return predicate that holds for a permission row granting {@code capability}
     */
    public static <F extends Field> Query<F> authorize(final String subject, final Capability capability,
                                                       final GrantColumns<F> columns) {
        final List<Query<F>> alternatives = new ArrayList<>();
        alternatives.add(grant(subject, RoleType.SERVER_ADMIN, capability, columns));

        switch (capability.resourceType()) {
            case SERVER -> {
                // server admins only
            }
            case ORGANIZATION -> {
                alternatives.add(grant(subject, RoleType.ORGANIZATION_ADMIN, capability, columns));
                if (capability.access() == Access.READ) {
                    alternatives.add(grant(subject, RoleType.ORGANIZATION_VIEWER, capability, columns));
                }
            }
            case EVENT -> {
                alternatives.add(grant(subject, RoleType.EVENT_ADMIN, capability, columns));
                alternatives.add(grant(subject, RoleType.ORGANIZATION_ADMIN, capability, columns));
                if (capability.access() != Access.ADMIN) {
                    alternatives.add(grant(subject, RoleType.EVENT_EDITOR, capability, columns));
                }
                if (capability.access() == Access.READ) {
                    alternatives.add(grant(subject, RoleType.EVENT_VIEWER, capability, columns));
                    alternatives.add(grant(subject, RoleType.ORGANIZATION_VIEWER, capability, columns));
                }
            }
            default -> throw new IllegalStateException("unhandled resource type " + capability.resourceType());
        }
        return Query.or(alternatives);
    }

    private static <F extends Field> Query<F> grant(final String subject, final RoleType role,
                                                    final Capability capability, final GrantColumns<F> columns) {
        final Query<F> grantee = Query.equalTo(columns.grantee(), subject);
        final Query<F> granted = Query.equalTo(columns.role(), role.name());
        if (capability.rowScoped()) {
            return Query.and(grantee, granted);
        }
        return switch (role.getResourceType()) {
            case SERVER -> Query.and(grantee, granted);
            case ORGANIZATION -> Query.and(grantee, granted,
                    Query.equalTo(columns.organization(), capability.organizationId()));
            case EVENT -> Query.and(grantee, granted, Query.equalTo(columns.event(), capability.eventId()));
        };
    }
}
