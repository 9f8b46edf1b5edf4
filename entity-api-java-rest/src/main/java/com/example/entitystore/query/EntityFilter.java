package com.example.entitystore.query;

import java.util.List;

/**
 * Predicate over the {@code data} document of stored entities.
 * <p>
 * Trees are built by {@link EntityFilterBuilder} from already validated input and turned into
 * engine-specific queries by a renderer such as {@link SqlFilterRenderer}.
 */
public interface EntityFilter {

    <R> R accept(EntityFilterVisitor<R> visitor);

    static EntityFilter pathEquals(List<String> path, String value) {
        return new PathEquals(path, value);
    }

    static EntityFilter contains(String json) {
        return new Contains(json);
    }

    static EntityFilter keyExists(String key) {
        return new KeyExists(null, key);
    }

    static EntityFilter keyExists(String parentKey, String key) {
        return new KeyExists(parentKey, key);
    }

    static EntityFilter and(List<EntityFilter> filters) {
        return new And(filters);
    }

    /** An empty conjunction, which every entity satisfies. */
    static EntityFilter matchAll() {
        return new And(List.of());
    }
}
