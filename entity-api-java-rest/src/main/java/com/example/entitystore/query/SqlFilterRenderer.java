package com.example.entitystore.query;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an {@link EntityFilter} into a PostgreSQL condition over a {@code jsonb} column.
 * <p>
 * Keys and values are always emitted as named bind markers, never inlined:
 * <ul>
 *   <li>path equality: {@code data -> :k0 ->> :k1 = :v2}</li>
 *   <li>containment: {@code data @> CAST(:c0 AS jsonb)}</li>
 *   <li>key existence: {@code jsonb_exists(data -> :k0, :k1)}</li>
 * </ul>
 * {@code jsonb_exists} is the function behind the {@code ?} operator, which would clash with
 * positional placeholders.
 */
@Component
public class SqlFilterRenderer {

    public static final String DATA_COLUMN = "data";

    public SqlFilter render(EntityFilter filter) {
        Rendering rendering = new Rendering();
        String condition = filter.accept(rendering);
        return new SqlFilter(condition, rendering.bindings);
    }

    private static final class Rendering implements EntityFilterVisitor<String> {
        private final Map<String, Object> bindings = new LinkedHashMap<>();

        @Override
        public String visitPathEquals(PathEquals filter) {
            List<String> path = filter.getPath();
            StringBuilder sql = new StringBuilder(DATA_COLUMN);
            for (int i = 0; i < path.size() - 1; i++) {
                sql.append(" -> ").append(bind("k", path.get(i)));
            }
            sql.append(" ->> ").append(bind("k", path.get(path.size() - 1)));
            sql.append(" = ").append(bind("v", filter.getValue()));
            return sql.toString();
        }

        @Override
        public String visitContains(Contains filter) {
            return DATA_COLUMN + " @> CAST(" + bind("c", filter.getJson()) + " AS jsonb)";
        }

        @Override
        public String visitKeyExists(KeyExists filter) {
            String target = filter.isNested()
                    ? DATA_COLUMN + " -> " + bind("k", filter.getParentKey())
                    : DATA_COLUMN;
            return "jsonb_exists(" + target + ", " + bind("k", filter.getKey()) + ")";
        }

        @Override
        public String visitAnd(And filter) {
            List<String> parts = filter.getFilters().stream()
                    .map(child -> child.accept(this))
                    .filter(part -> !part.isEmpty())
                    .collect(Collectors.toList());
            if (parts.size() == 1) {
                return parts.get(0);
            }
            return parts.stream()
                    .map(part -> "(" + part + ")")
                    .collect(Collectors.joining(" AND "));
        }

        private String bind(String prefix, Object value) {
            String name = prefix + bindings.size();
            bindings.put(name, value);
            return ":" + name;
        }
    }
}
