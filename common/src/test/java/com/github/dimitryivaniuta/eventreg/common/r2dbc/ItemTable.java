package com.github.dimitryivaniuta.eventreg.common.r2dbc;

import com.github.dimitryivaniuta.eventreg.common.query.Field;

/** Fixture tables for the R2DBC tests. */
enum ItemTable implements ReferenceTable {
    ITEMS("items");

    private final String tableName;

    ItemTable(final String tableName) {
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
