package com.example.entitystore.query;

import lombok.Value;

/**
 * Matches when the document is a structural superset of {@code json}.
 */
@Value
public class Contains implements EntityFilter {
    String json; // canonical JSON text

    @Override
    public <R> R accept(EntityFilterVisitor<R> visitor) {
        return visitor.visitContains(this);
    }
}
