package com.csvslicer.model;

import java.util.List;

/**
 * Ingestion settings shared by the commands.
 *
 * @param headerRow        row holding the column names after skipped rows are removed; negative means none
 * @param skipRows         records ignored before the header row is picked
 * @param columnNames      replacement names assigned in order, empty to keep the file's names
 * @param keepEmptyColumns keep columns whose header is blank
 */
public record CsvReadOptions(int headerRow, SkipRows skipRows, List<String> columnNames, boolean keepEmptyColumns) {

    public CsvReadOptions {
        columnNames = List.copyOf(columnNames);
    }

    public static CsvReadOptions defaults() {
        return new CsvReadOptions(0, new SkipRows.None(), List.of(), false);
    }

    public boolean hasHeader() {
        return headerRow >= 0;
    }
}
