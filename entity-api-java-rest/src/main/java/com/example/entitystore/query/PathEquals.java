package com.example.entitystore.query;

import lombok.Value;

import java.util.List;

/**
 * Matches when the value reached by descending {@code path}, read as text, equals {@code value}.
 */
@Value
public class PathEquals implements EntityFilter {
    List<String> path;
    String value;

    public PathEquals(List<String> path, String value) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must have at least one segment");
        }
        this.path = List.copyOf(path);
        this.value = value;
    }

    @Override
    public <R> R accept(EntityFilterVisitor<R> visitor) {
        return visitor.visitPathEquals(this);
    }
}
