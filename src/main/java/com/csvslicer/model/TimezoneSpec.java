package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;

import java.util.Optional;

/**
 * The {@code adjust-tz} option, {@code <hours>:<zone>} such as {@code 3.5:UTC} or {@code -5:America/New_York}.
 */
public record TimezoneSpec(double hours, String zone) {

    public static Optional<TimezoneSpec> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String[] parts = value.strip().split(":", 2);
        if (parts.length != 2 || parts[1].isBlank()) {
            throw new SlicerConfigException("Invalid timezone adjustment '" + value + "', expected <hours>:<zone>");
        }
        try {
            return Optional.of(new TimezoneSpec(Double.parseDouble(parts[0].strip()), parts[1].strip()));
        } catch (NumberFormatException e) {
            throw new SlicerConfigException("Invalid hour offset in timezone adjustment '" + value + "'", e);
        }
    }
}
