package com.paramguard.utils;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * Jackson access for request bodies, responses and the endpoint catalog. Response
 * properties are written in snake_case and null properties are left out; map keys are
 * written as given.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setPropertyNamingStrategy(SNAKE_CASE)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private Json() {}

    /**
     * Parameter and property names go through this, so a Java parameter {@code userId}
     * is looked up as {@code user_id}.
     */
    public static String toSnakeCase(final String camel) {
        return SNAKE_CASE.translate(camel);
    }

    /**
     * @throws IllegalStateException if the value cannot be written, which means a response
     *         type Jackson cannot handle
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write " + value.getClass().getName() + " as JSON", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not JSON of the given shape
     */
    public static <T> T readValue(final String json, final Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read JSON as " + type.getSimpleName(), e);
        }
    }

    /**
     * Top-level fields of a request body, in document order. Arrays, scalars and blank
     * bodies carry no named fields and yield an empty map.
     *
     * @throws IllegalArgumentException if the body is not valid JSON
     */
    public static Map<String, Object> readObject(final String body) {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON body", e);
        }
        return root.isObject() ? MAPPER.convertValue(root, FIELDS) : new LinkedHashMap<>();
    }
}
