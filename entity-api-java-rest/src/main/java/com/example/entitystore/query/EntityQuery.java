package com.example.entitystore.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional document filters taken from the list endpoint's query string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityQuery {
    private String jsonPath;
    private String jsonValue;
    private String jsonContains;
    private String jsonKeyExists;
}
