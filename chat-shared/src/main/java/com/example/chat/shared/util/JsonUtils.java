package com.example.chat.shared.util;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.util.stream.Collectors;

/**
 * Helpers for reporting JSON payload problems using the wire (snake_case) field names.
 */
public final class JsonUtils {

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private JsonUtils() {}

    /**
     * Converts a Java property name such as {@code isTyping} to its wire name {@code is_typing}.
     */
    public static String toSnakeCase(String propertyName) {
        if (propertyName == null || propertyName.isEmpty()) {
            return propertyName;
        }
        return SNAKE_CASE.translate(propertyName);
    }

    /**
     * Dotted path of the field a mapping exception refers to, e.g. {@code participants[2]}.
     * Returns {@code "data"} when the exception carries no path.
     */
    public static String fieldPath(JsonMappingException e) {
        if (e.getPath() == null || e.getPath().isEmpty()) {
            return "data";
        }
        return e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."))
                .replace(".[", "[");
    }
}
