package com.example.entitystore.query;

import com.example.entitystore.config.AppConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns the list endpoint's optional query parameters into a single {@link EntityFilter}.
 * <p>
 * Each parameter is validated before it contributes a predicate; the first invalid one aborts
 * the whole build so no partially filtered query is ever run. A parameter counts as supplied
 * only when it is non-empty. {@code json_path} and {@code json_value} only apply together:
 * when just one of them is given the path filter is skipped without error.
 */
@Component
@Slf4j
public class EntityFilterBuilder {

    public static final String JSON_PATH = "json_path";
    public static final String JSON_VALUE = "json_value";
    public static final String JSON_CONTAINS = "json_contains";
    public static final String JSON_KEY_EXISTS = "json_key_exists";

    private final JsonInputValidator validator;
    private final ObjectMapper objectMapper;
    private final AppConfig.QueryConfig limits;

    public EntityFilterBuilder(JsonInputValidator validator, ObjectMapper objectMapper, AppConfig config) {
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.limits = config.getQuery();
    }

    public FilterResult build(EntityQuery query) {
        List<EntityFilter> filters = new ArrayList<>();

        String jsonPath = query.getJsonPath();
        String jsonValue = query.getJsonValue();
        if (StringUtils.hasLength(jsonPath) && StringUtils.hasLength(jsonValue)) {
            if (!validator.validateJsonPath(jsonPath)) {
                return reject(QueryErrorKind.INVALID_PATH, JSON_PATH, "Invalid JSON path format");
            }
            if (JsonInputValidator.lengthOf(jsonValue) > limits.getMaxValueLength()) {
                return reject(QueryErrorKind.VALUE_TOO_LONG, JSON_VALUE, "JSON value too long");
            }
            filters.add(EntityFilter.pathEquals(splitPath(jsonPath), jsonValue));
        }

        String jsonContains = query.getJsonContains();
        if (StringUtils.hasLength(jsonContains)) {
            if (!validator.validateJsonString(jsonContains, limits.getMaxContainsLength())) {
                return reject(QueryErrorKind.INVALID_CONTAINS_JSON, JSON_CONTAINS, "Invalid JSON format or too long");
            }
            try {
                JsonNode expected = validator.parseJson(jsonContains);
                filters.add(EntityFilter.contains(objectMapper.writeValueAsString(expected)));
            } catch (JsonProcessingException e) {
                return reject(QueryErrorKind.INVALID_CONTAINS_JSON, JSON_CONTAINS, "Invalid JSON in json_contains");
            }
        }

        String jsonKeyExists = query.getJsonKeyExists();
        if (StringUtils.hasLength(jsonKeyExists)) {
            if (!validator.validateJsonPath(jsonKeyExists)) {
                return reject(QueryErrorKind.INVALID_KEY_PATH, JSON_KEY_EXISTS, "Invalid JSON key path format");
            }
            List<String> parts = splitPath(jsonKeyExists);
            if (parts.size() == 1) {
                filters.add(EntityFilter.keyExists(parts.get(0)));
            } else if (parts.size() == 2) {
                filters.add(EntityFilter.keyExists(parts.get(0), parts.get(1)));
            } else {
                return reject(QueryErrorKind.NESTED_KEY_TOO_DEEP, JSON_KEY_EXISTS, "Nested key check supports only one level");
            }
        }

        log.debug("Built entity filter with {} predicate(s)", filters.size());
        return FilterResult.success(EntityFilter.and(filters));
    }

    /**
     * Checks the pagination window of a list request; empty when it is acceptable.
     */
    public Optional<QueryError> checkPagination(int skip, int limit) {
        if (skip < 0 || skip > limits.getMaxSkip()) {
            return Optional.of(logged(QueryError.of(QueryErrorKind.INVALID_PAGINATION, "skip",
                    String.format("skip must be between 0 and %d", limits.getMaxSkip()))));
        }
        if (limit < 1 || limit > limits.getMaxLimit()) {
            return Optional.of(logged(QueryError.of(QueryErrorKind.INVALID_PAGINATION, "limit",
                    String.format("limit must be between 1 and %d", limits.getMaxLimit()))));
        }
        return Optional.empty();
    }

    private static List<String> splitPath(String path) {
        return Arrays.asList(path.split("\\."));
    }

    private static FilterResult reject(QueryErrorKind kind, String parameter, String message) {
        return FilterResult.failure(logged(QueryError.of(kind, parameter, message)));
    }

    private static QueryError logged(QueryError error) {
        log.warn("Rejected {} parameter: {} ({})", error.getParameter(), error.getMessage(), error.getKind());
        return error;
    }
}
