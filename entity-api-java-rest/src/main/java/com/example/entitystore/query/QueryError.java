package com.example.entitystore.query;

import lombok.Value;

/**
 * A rejected list-query parameter: what went wrong, which parameter, and the client-facing message.
 */
@Value(staticConstructor = "of")
public class QueryError {
    QueryErrorKind kind;
    String parameter;
    String message;
}
