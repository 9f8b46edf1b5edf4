package com.example.entitystore.constants;

public final class ApiConstants {

    public static final String API_NAME = "[entity-api-java-rest]";

    public static final String ENTITIES_TABLE = "entities";

    private ApiConstants() {
    }
}
