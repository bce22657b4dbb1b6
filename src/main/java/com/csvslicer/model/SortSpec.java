package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;

/**
 * The merge {@code sort} option, {@code <column index>,<ASC|DESC>}.
 */
public record SortSpec(int column, boolean ascending) {

    public static SortSpec parse(String value) {
        String[] parts = value == null ? new String[0] : value.split(",");
        if (parts.length != 2) {
            throw new SlicerConfigException("Invalid sort '" + value + "', expected <column>,<ASC|DESC>");
        }
        int column;
        try {
            column = Integer.parseInt(parts[0].strip());
        } catch (NumberFormatException e) {
            throw new SlicerConfigException("Invalid sort column in '" + value + "'", e);
        }
        return switch (parts[1].strip().toUpperCase()) {
            case "ASC" -> new SortSpec(column, true);
            case "DESC" -> new SortSpec(column, false);
            default -> throw new SlicerConfigException("Invalid sort direction in '" + value + "', expected ASC or DESC");
        };
    }
}
