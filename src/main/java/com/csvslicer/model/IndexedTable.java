package com.csvslicer.model;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * A table whose index column has been converted to zone-aware timestamps.
 *
 * @param indexColumn name written as the first column of every output file
 * @param columns     the other columns, in output order
 * @param rows        rows in input order
 * @param zone        zone the index was adjusted or localized to
 */
public record IndexedTable(String indexColumn, List<String> columns, List<TimedRow> rows, ZoneId zone) {

    public IndexedTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public List<ZonedDateTime> timestamps() {
        return rows.stream().map(TimedRow::timestamp).toList();
    }

    public List<TimedRow> select(List<Integer> positions) {
        return positions.stream().map(rows::get).toList();
    }
}
