package com.github.dimitryivaniuta.eventreg.server.web;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.List;

/** Size rules for batch requests. */
public final class Batches {

    /** Largest number of items accepted by one upsert or delete. */
    public static final int MAX_ITEMS = 100;

    private Batches() {
    }

    /**
     * @throws ValidationException when {@code items} is missing, empty or larger than
     *                             {@link #MAX_ITEMS}
     */
    public static <T> List<T> require(final List<T> items, final String field) {
        if (items == null || items.isEmpty()) {
            throw ValidationException.empty(field);
        }
        if (items.size() > MAX_ITEMS) {
            throw ValidationException.tooManyItems(field);
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) {
                throw ValidationException.empty(field + "[" + i + "]");
            }
        }
        return items;
    }
}
