package com.example.entitystore.query;

import lombok.Value;

import java.util.Map;

/**
 * A rendered {@code WHERE} condition and the named values it binds.
 * An empty condition means no restriction.
 */
@Value
public class SqlFilter {
    String condition;
    Map<String, Object> bindings;

    public boolean hasCondition() {
        return !condition.isEmpty();
    }
}
