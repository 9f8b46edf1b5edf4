package com.example.entitystore.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of building a filter: either a composed {@link EntityFilter} or the {@link QueryError}
 * that stopped the build.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FilterResult {
    private final EntityFilter filter;
    private final QueryError error;

    public static FilterResult success(EntityFilter filter) {
        return new FilterResult(filter, null);
    }

    public static FilterResult failure(QueryError error) {
        return new FilterResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
