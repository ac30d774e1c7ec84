package com.github.dimitryivaniuta.eventreg.common.r2dbc;

import com.github.dimitryivaniuta.eventreg.common.query.Field;

/**
 * A table whose ids may be referenced by other rows and therefore be existence-checked.
 * Implemented by an enum so the set of tables is closed.
 */
public interface ReferenceTable {

    /** Unqualified table name. */
    String tableName();

    /** Id column of the table, unqualified. */
    Field idField();
}
