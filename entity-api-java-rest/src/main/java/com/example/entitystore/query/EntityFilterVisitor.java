package com.example.entitystore.query;

public interface EntityFilterVisitor<R> {

    R visitPathEquals(PathEquals filter);

    R visitContains(Contains filter);

    R visitKeyExists(KeyExists filter);

    R visitAnd(And filter);
}
