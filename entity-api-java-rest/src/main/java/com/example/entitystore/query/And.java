package com.example.entitystore.query;

import lombok.Value;

import java.util.List;

@Value
public class And implements EntityFilter {
    List<EntityFilter> filters;

    public And(List<EntityFilter> filters) {
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    @Override
    public <R> R accept(EntityFilterVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
