package com.github.dimitryivaniuta.eventreg.server.event;

import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.query.FieldCatalog;
import com.github.dimitryivaniuta.eventreg.server.permission.GrantColumns;

/** Fields of an event query; {@code GRANT*} constants address the joined permissions. */
public enum EventField implements Field {
    ID("e.id", "id", true),
    ORGANIZATION_ID("e.organization_id", "organizationId", true),
    NAME("e.name", "name", true),
    GRANTEE("p.user_id", "grantee", false),
    GRANTED_ROLE("p.role", "grantedRole", false),
    GRANTED_ORGANIZATION("p.organization_id", "grantedOrganization", false),
    GRANTED_EVENT("p.event_id", "grantedEvent", false);

    public static final GrantColumns<EventField> GRANTS =
            new GrantColumns<>(GRANTEE, GRANTED_ROLE, GRANTED_ORGANIZATION, GRANTED_EVENT);

    public static final FieldCatalog<EventField> CATALOG = FieldCatalog.of(EventField.class);

    private final String column;
    private final String wireName;
    private final boolean queryable;

    EventField(final String column, final String wireName, final boolean queryable) {
        this.column = column;
        this.wireName = wireName;
        this.queryable = queryable;
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

    @Override
    public boolean queryable() {
        return queryable;
    }
}
