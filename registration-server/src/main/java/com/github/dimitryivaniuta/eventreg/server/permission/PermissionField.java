package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.query.FieldCatalog;

/** Columns of the {@code permissions} table (alias {@code p}). */
public enum PermissionField implements Field {
    ID("p.id", "id"),
    USER_ID("p.user_id", "userId"),
    ROLE("p.role", "role"),
    ORGANIZATION_ID("p.organization_id", "organizationId"),
    EVENT_ID("p.event_id", "eventId");

    public static final GrantColumns<PermissionField> GRANTS =
            new GrantColumns<>(USER_ID, ROLE, ORGANIZATION_ID, EVENT_ID);

    public static final FieldCatalog<PermissionField> CATALOG = FieldCatalog.of(PermissionField.class);

    private final String column;
    private final String wireName;

    PermissionField(final String column, final String wireName) {
        this.column = column;
        this.wireName = wireName;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public Class<?> valueType() {
        return String.class;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
