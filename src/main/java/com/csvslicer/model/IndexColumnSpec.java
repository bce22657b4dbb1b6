package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;

/**
 * The index column option, {@code name} or {@code name:rename}.
 */
public record IndexColumnSpec(String name, String rename) {

    public static IndexColumnSpec parse(String value) {
        if (value == null || value.isBlank()) {
            throw new SlicerConfigException("An index column is required");
        }
        String[] parts = value.strip().split(":", 2);
        if (parts[0].isBlank() || (parts.length == 2 && parts[1].isBlank())) {
            throw new SlicerConfigException("Invalid index column '" + value + "', expected name or name:rename");
        }
        return new IndexColumnSpec(parts[0].strip(), parts.length == 2 ? parts[1].strip() : null);
    }

    public String outputName() {
        return rename != null ? rename : name;
    }
}
