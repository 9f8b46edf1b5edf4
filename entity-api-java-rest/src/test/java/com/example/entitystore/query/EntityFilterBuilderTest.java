package com.example.entitystore.query;

import com.example.entitystore.config.AppConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EntityFilterBuilderTest {

    private EntityFilterBuilder filterBuilder;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        AppConfig config = new AppConfig();
        filterBuilder = new EntityFilterBuilder(new JsonInputValidator(objectMapper, config), objectMapper, config);
    }

    @Test
    void build_WithNoParameters_ShouldMatchAll() {
        FilterResult result = filterBuilder.build(new EntityQuery());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilter()).isEqualTo(EntityFilter.matchAll());
    }

    @Test
    void build_WithTopLevelPath_ShouldAddSingleSegmentPathEquals() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("name")
                .jsonValue("alice")
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(conjuncts(result)).containsExactly(new PathEquals(List.of("name"), "alice"));
    }

    @Test
    void build_WithNestedPath_ShouldSplitSegments() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("b.c")
                .jsonValue("2")
                .build());

        assertThat(conjuncts(result)).containsExactly(new PathEquals(List.of("b", "c"), "2"));
    }

    @Test
    void build_WithPathButNoValue_ShouldSkipPathFilter() {
        FilterResult pathOnly = filterBuilder.build(EntityQuery.builder().jsonPath("b.c").build());
        FilterResult valueOnly = filterBuilder.build(EntityQuery.builder().jsonValue("2").build());
        FilterResult emptyValue = filterBuilder.build(EntityQuery.builder().jsonPath("b.c").jsonValue("").build());

        assertThat(conjuncts(pathOnly)).isEmpty();
        assertThat(conjuncts(valueOnly)).isEmpty();
        assertThat(conjuncts(emptyValue)).isEmpty();
    }

    @Test
    void build_WithPathOnlyEvenIfInvalid_ShouldStillSkip() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonPath("bad path!").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(conjuncts(result)).isEmpty();
    }

    @Test
    void build_WithInvalidPath_ShouldReturnInvalidPath() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("a'; DROP TABLE entities; --")
                .jsonValue("x")
                .build());

        assertError(result, QueryErrorKind.INVALID_PATH, "json_path", "Invalid JSON path format");
    }

    @Test
    void build_WithTooDeepPath_ShouldReturnInvalidPath() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("a.b.c.d.e.f.g")
                .jsonValue("x")
                .build());

        assertError(result, QueryErrorKind.INVALID_PATH, "json_path", "Invalid JSON path format");
    }

    @Test
    void build_WithTooLongValue_ShouldReturnValueTooLong() {
        FilterResult atLimit = filterBuilder.build(EntityQuery.builder()
                .jsonPath("a")
                .jsonValue("v".repeat(1000))
                .build());
        FilterResult overLimit = filterBuilder.build(EntityQuery.builder()
                .jsonPath("a")
                .jsonValue("v".repeat(1001))
                .build());

        assertThat(atLimit.isSuccess()).isTrue();
        assertError(overLimit, QueryErrorKind.VALUE_TOO_LONG, "json_value", "JSON value too long");
    }

    @Test
    void build_WithContains_ShouldAddCanonicalContainment() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonContains("{ \"a\" : 1 }")
                .build());

        assertThat(conjuncts(result)).containsExactly(new Contains("{\"a\":1}"));
    }

    @Test
    void build_WithMalformedContains_ShouldReturnInvalidContainsJson() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonContains("{bad").build());

        assertError(result, QueryErrorKind.INVALID_CONTAINS_JSON, "json_contains", "Invalid JSON format or too long");
    }

    @Test
    void build_WithTooLongContains_ShouldReturnInvalidContainsJson() {
        String tooLong = "{\"a\":\"" + "x".repeat(5000) + "\"}";

        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonContains(tooLong).build());

        assertError(result, QueryErrorKind.INVALID_CONTAINS_JSON, "json_contains", "Invalid JSON format or too long");
    }

    @Test
    void build_WithTopLevelKeyExists_ShouldAddKeyExists() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonKeyExists("a").build());

        assertThat(conjuncts(result)).containsExactly(new KeyExists(null, "a"));
    }

    @Test
    void build_WithNestedKeyExists_ShouldAddParentAndKey() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonKeyExists("b.c").build());

        assertThat(conjuncts(result)).containsExactly(new KeyExists("b", "c"));
    }

    @Test
    void build_WithThreeSegmentKeyExists_ShouldReturnNestedKeyTooDeep() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonKeyExists("b.c.d").build());

        assertError(result, QueryErrorKind.NESTED_KEY_TOO_DEEP, "json_key_exists",
                "Nested key check supports only one level");
    }

    @Test
    void build_WithInvalidKeyPath_ShouldReturnInvalidKeyPath() {
        FilterResult result = filterBuilder.build(EntityQuery.builder().jsonKeyExists("b..c").build());

        assertError(result, QueryErrorKind.INVALID_KEY_PATH, "json_key_exists", "Invalid JSON key path format");
    }

    @Test
    void build_WithAllParameters_ShouldComposeInOrder() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("b.c")
                .jsonValue("2")
                .jsonContains("{\"a\":1}")
                .jsonKeyExists("b")
                .build());

        assertThat(conjuncts(result)).containsExactly(
                new PathEquals(List.of("b", "c"), "2"),
                new Contains("{\"a\":1}"),
                new KeyExists(null, "b"));
    }

    @Test
    void build_WithOneInvalidAmongValid_ShouldRejectWholeRequest() {
        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath("b.c")
                .jsonValue("2")
                .jsonContains("{\"a\":1}")
                .jsonKeyExists("b.c.d")
                .build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFilter()).isNull();
        assertThat(result.getError().getKind()).isEqualTo(QueryErrorKind.NESTED_KEY_TOO_DEEP);
    }

    @Test
    void checkPagination_ShouldEnforceBounds() {
        assertThat(filterBuilder.checkPagination(0, 1)).isEmpty();
        assertThat(filterBuilder.checkPagination(10000, 1000)).isEmpty();

        Optional<QueryError> negativeSkip = filterBuilder.checkPagination(-1, 100);
        assertThat(negativeSkip).isPresent();
        assertThat(negativeSkip.get().getKind()).isEqualTo(QueryErrorKind.INVALID_PAGINATION);
        assertThat(negativeSkip.get().getParameter()).isEqualTo("skip");

        assertThat(filterBuilder.checkPagination(10001, 100)).map(QueryError::getParameter).contains("skip");
        assertThat(filterBuilder.checkPagination(0, 0)).map(QueryError::getParameter).contains("limit");
        assertThat(filterBuilder.checkPagination(0, 1001)).map(QueryError::getParameter).contains("limit");
    }

    private static List<EntityFilter> conjuncts(FilterResult result) {
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilter()).isInstanceOf(And.class);
        return ((And) result.getFilter()).getFilters();
    }

    private static void assertError(FilterResult result, QueryErrorKind kind, String parameter, String message) {
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(QueryError.of(kind, parameter, message));
    }
}
