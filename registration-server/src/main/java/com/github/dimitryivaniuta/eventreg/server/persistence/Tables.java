package com.github.dimitryivaniuta.eventreg.server.persistence;

import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.ReferenceTable;

/** Tables whose ids other rows and requests refer to. */
public enum Tables implements ReferenceTable {
    USERS("users"),
    ORGANIZATIONS("organizations"),
    EVENTS("events"),
    PERMISSIONS("permissions");

    private final String tableName;

    Tables(final String tableName) {
        this.tableName = tableName;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public Field idField() {
        return IdColumn.ID;
    }

    /** Unqualified primary key column shared by every table. */
    enum IdColumn implements Field {
        ID;

        @Override
        public String column() {
            return "id";
        }

        @Override
        public Class<?> valueType() {
            return String.class;
        }

        @Override
        public String wireName() {
            return "id";
        }
    }
}
