package com.example.entitystore.query;

public enum QueryErrorKind {
    INVALID_PATH,
    VALUE_TOO_LONG,
    INVALID_CONTAINS_JSON,
    INVALID_KEY_PATH,
    NESTED_KEY_TOO_DEEP,
    INVALID_PAGINATION
}
