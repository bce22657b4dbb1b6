package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * An in-memory CSV table: ordered column names and rows of text cells, every row as wide as the header.
 */
public record CsvTable(List<String> columns, List<List<String>> rows) {

    public CsvTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public int requireColumn(String column) {
        int index = columnIndex(column);
        if (index < 0) {
            throw new SlicerConfigException("Column '" + column + "' not found, available columns: " + columns);
        }
        return index;
    }

    public List<String> column(String column) {
        int index = requireColumn(column);
        return rows.stream().map(row -> row.get(index)).toList();
    }

    public CsvTable renameColumn(String from, String to) {
        int index = requireColumn(from);
        List<String> renamed = new ArrayList<>(columns);
        renamed.set(index, to);
        return new CsvTable(renamed, rows);
    }

    public CsvTable dropColumns(Collection<String> dropped) {
        List<Integer> keep = new ArrayList<>();
        for (String column : dropped) {
            requireColumn(column);
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!dropped.contains(columns.get(i))) {
                keep.add(i);
            }
        }
        return project(keep);
    }

    /**
     * Replaces the cells of one column, keeping its position.
     */
    public CsvTable withColumnValues(String column, List<String> values) {
        int index = requireColumn(column);
        checkHeight(values);
        List<List<String>> updated = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = new ArrayList<>(rows.get(r));
            row.set(index, values.get(r));
            updated.add(row);
        }
        return new CsvTable(columns, updated);
    }

    /**
     * Inserts a new column at {@code position}; a negative position appends it.
     */
    public CsvTable insertColumn(int position, String column, List<String> values) {
        if (columns.contains(column)) {
            throw new SlicerConfigException("Column '" + column + "' already exists");
        }
        checkHeight(values);
        int at = position < 0 || position > columns.size() ? columns.size() : position;
        List<String> header = new ArrayList<>(columns);
        header.add(at, column);
        List<List<String>> updated = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = new ArrayList<>(rows.get(r));
            row.add(at, values.get(r));
            updated.add(row);
        }
        return new CsvTable(header, updated);
    }

    public CsvTable project(List<Integer> columnIndexes) {
        List<String> header = columnIndexes.stream().map(columns::get).toList();
        List<List<String>> projected = rows.stream()
                .map(row -> columnIndexes.stream().map(row::get).toList())
                .toList();
        return new CsvTable(header, projected);
    }

    private void checkHeight(List<String> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Expected " + rows.size() + " values but got " + values.size());
        }
    }
}
