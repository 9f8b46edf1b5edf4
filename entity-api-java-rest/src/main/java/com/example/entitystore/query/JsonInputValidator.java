package com.example.entitystore.query;

import com.example.entitystore.config.AppConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Checks user-supplied JSON paths and JSON text before they are allowed to shape a query.
 * <p>
 * Path segments end up as keys navigated inside the {@code data} column, so they are held to an
 * allow-list pattern plus length and depth caps rather than relying on parameter binding alone.
 * All checks are side-effect free.
 */
@Component
public class JsonInputValidator {

    static final Pattern JSON_PATH_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+(\\.[a-zA-Z0-9_]+)*$");

    private final ObjectReader strictReader;
    private final AppConfig.QueryConfig limits;

    public JsonInputValidator(ObjectMapper objectMapper, AppConfig config) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.limits = config.getQuery();
    }

    /**
     * Accepts dotted paths such as {@code user.age}: non-empty, at most
     * {@code max-path-length} characters, word-character segments joined by single dots,
     * and no more than {@code max-path-depth} dots.
     */
    public boolean validateJsonPath(String path) {
        if (path == null || path.isEmpty() || lengthOf(path) > limits.getMaxPathLength()) {
            return false;
        }
        if (!JSON_PATH_PATTERN.matcher(path).matches()) {
            return false;
        }
        return StringUtils.countOccurrencesOf(path, ".") <= limits.getMaxPathDepth();
    }

    public boolean validateJsonString(String text) {
        return validateJsonString(text, limits.getMaxContainsLength());
    }

    /**
     * Accepts non-empty text of at most {@code maxLength} characters holding exactly one
     * well-formed JSON value.
     */
    public boolean validateJsonString(String text, int maxLength) {
        if (text == null || text.isEmpty() || lengthOf(text) > maxLength) {
            return false;
        }
        try {
            parseJson(text);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * Parses exactly one JSON value. Blank input and trailing content are rejected.
     */
    public JsonNode parseJson(String text) throws JsonProcessingException {
        JsonNode node = strictReader.readTree(text);
        if (node == null || node.isMissingNode()) {
            throw MismatchedInputException.from(null, JsonNode.class, "No JSON content");
        }
        return node;
    }

    /** Length in code points, so a non-BMP character counts once. */
    static int lengthOf(String text) {
        return text.codePointCount(0, text.length());
    }
}
