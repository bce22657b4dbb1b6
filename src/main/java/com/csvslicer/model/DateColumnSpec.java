package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * How convert-date builds its timestamp column: convert an existing column in place (or leave it untouched),
 * or combine several columns into a new one.
 */
public sealed interface DateColumnSpec permits DateColumnSpec.Flag, DateColumnSpec.Combine {

    /**
     * Reads the value as JSON first ({@code true}, {@code false} or an array of column names), then as a plain
     * boolean literal. Anything else is rejected.
     */
    static DateColumnSpec parse(String value, ObjectMapper objectMapper) {
        if (value == null || value.isBlank()) {
            throw new SlicerConfigException("Timestamp option must be true, false or a JSON list of columns");
        }
        String trimmed = value.strip();
        JsonNode node = readJson(trimmed, objectMapper);
        if (node != null) {
            if (node.isBoolean()) {
                return new Flag(node.booleanValue());
            }
            if (node.isArray() && !node.isEmpty()) {
                List<String> columns = new ArrayList<>();
                for (JsonNode element : node) {
                    if (!element.isTextual()) {
                        throw new SlicerConfigException("Timestamp column list must contain column names: " + trimmed);
                    }
                    columns.add(element.textValue());
                }
                return new Combine(columns);
            }
        }
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return new Flag(Boolean.parseBoolean(trimmed));
        }
        throw new SlicerConfigException("Timestamp option must be true, false or a JSON list of columns, got '" + value + "'");
    }

    private static JsonNode readJson(String value, ObjectMapper objectMapper) {
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    record Flag(boolean enabled) implements DateColumnSpec {
    }

    record Combine(List<String> columns) implements DateColumnSpec {
        public Combine {
            columns = List.copyOf(columns);
        }
    }
}
