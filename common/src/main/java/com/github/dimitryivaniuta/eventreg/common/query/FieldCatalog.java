package com.github.dimitryivaniuta.eventreg.common.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of an entity's publicly queryable fields by wire name.
 *
 * @param <F> field enum of the entity
 */
public final class FieldCatalog<F extends Enum<F> & Field> {

    private final Map<String, F> byWireName;

    private FieldCatalog(final Map<String, F> byWireName) {
        this.byWireName = Collections.unmodifiableMap(byWireName);
    }

    /** Builds a catalog of every {@link Field#queryable()} constant of {@code type}. */
    public static <F extends Enum<F> & Field> FieldCatalog<F> of(final Class<F> type) {
        final Map<String, F> map = new LinkedHashMap<>();
        for (F f : type.getEnumConstants()) {
            if (f.queryable()) {
                map.put(f.wireName(), f);
            }
        }
        return new FieldCatalog<>(map);
    }

    public Optional<F> find(final String wireName) {
        if (wireName == null) return Optional.empty();
        return Optional.ofNullable(byWireName.get(wireName.trim()));
    }
}
