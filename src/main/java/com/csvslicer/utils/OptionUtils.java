package com.csvslicer.utils;

import com.csvslicer.exception.SlicerConfigException;

import java.util.Arrays;
import java.util.List;

public final class OptionUtils {

    private OptionUtils() {
    }

    /**
     * Splits a comma separated option into trimmed, non-empty items.
     */
    public static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(item -> !item.isEmpty())
                .toList();
    }

    public static String require(String value, String option) {
        if (value == null || value.isBlank()) {
            throw new SlicerConfigException("Option '" + option + "' is required");
        }
        return value.strip();
    }

    public static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(require(value, option));
        } catch (NumberFormatException e) {
            throw new SlicerConfigException("Option '" + option + "' must be an integer, got '" + value + "'", e);
        }
    }
}
