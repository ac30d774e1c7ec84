package com.github.dimitryivaniuta.eventreg.common.query;

/** Field set of the {@code items} fixture table used across the engine tests. */
public enum ItemField implements Field {
    ID("i.id", "id", String.class, true),
    NAME("i.name", "name", String.class, true),
    OWNER("i.owner", "owner", String.class, true),
    QUANTITY("i.quantity", "quantity", Long.class, true),
    SECRET("i.secret", "secret", String.class, false);

    private final String column;
    private final String wireName;
    private final Class<?> valueType;
    private final boolean queryable;

    ItemField(final String column, final String wireName, final Class<?> valueType, final boolean queryable) {
        this.column = column;
        this.wireName = wireName;
        this.valueType = valueType;
        this.queryable = queryable;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public Class<?> valueType() {
        return valueType;
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
