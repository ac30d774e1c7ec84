package com.github.dimitryivaniuta.eventreg.server.user;

import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.query.FieldCatalog;
import java.util.Locale;

/** Columns of the {@code users} table (alias {@code u}). The password hash is not a field. */
public enum UserField implements Field {
    ID("u.id"),
    EMAIL("u.email"),
    STATUS("u.status");

    public static final FieldCatalog<UserField> CATALOG = FieldCatalog.of(UserField.class);

    private final String column;

    UserField(final String column) {
        this.column = column;
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
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean queryable() {
        return true;
    }
}
