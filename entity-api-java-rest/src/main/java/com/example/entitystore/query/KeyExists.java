package com.example.entitystore.query;

import lombok.Value;

/**
 * Matches when {@code key} is present at the top level, or inside the object held by
 * {@code parentKey} when one is set.
 */
@Value
public class KeyExists implements EntityFilter {
    String parentKey;
    String key;

    public boolean isNested() {
        return parentKey != null;
    }

    @Override
    public <R> R accept(EntityFilterVisitor<R> visitor) {
        return visitor.visitKeyExists(this);
    }
}
