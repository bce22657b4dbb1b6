package com.csvslicer.io;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.CsvTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Loads CSV files into {@link CsvTable}s: skipped records, header row selection, blank-header columns and
 * column renaming.
 */
@Component
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private final CsvMapper csvMapper;

    public CsvTableReader(@Qualifier("csvMapper") CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    public CsvTable read(Path file, CsvReadOptions options) throws IOException {
        List<List<String>> records = readRecords(file);

        List<List<String>> kept = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            if (!options.skipRows().skips(i)) {
                kept.add(records.get(i));
            }
        }

        List<String> header;
        List<List<String>> data;
        if (options.hasHeader()) {
            if (options.headerRow() >= kept.size()) {
                throw new SlicerConfigException("Header row " + options.headerRow() + " is past the end of " + file);
            }
            header = kept.get(options.headerRow());
            data = kept.subList(options.headerRow() + 1, kept.size());
        } else {
            int width = kept.stream().mapToInt(List::size).max().orElse(0);
            header = IntStream.range(0, width).mapToObj(String::valueOf).toList();
            data = kept;
        }

        CsvTable table = new CsvTable(nameColumns(header), padRows(file, header.size(), data));
        if (!options.keepEmptyColumns()) {
            table = dropUnnamedColumns(table);
        }
        if (!options.columnNames().isEmpty()) {
            table = assignColumnNames(file, table, options.columnNames());
        }
        log.debug("Read {} rows with columns {} from {}", table.size(), table.columns(), file);
        return table;
    }

    /**
     * Reads every non-empty record of a file as a list of cells, without header interpretation.
     */
    public List<List<String>> readRecords(Path file) throws IOException {
        try (MappingIterator<List<String>> records = csvMapper.readerForListOf(String.class).readValues(file.toFile())) {
            return records.readAll();
        }
    }

    private static List<String> nameColumns(List<String> header) {
        List<String> names = new ArrayList<>(header.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i) == null ? "" : header.get(i).strip();
            if (name.isEmpty()) {
                name = UNNAMED_PREFIX + i;
            }
            String unique = name;
            for (int n = 1; !seen.add(unique); n++) {
                unique = name + "." + n;
            }
            names.add(unique);
        }
        return names;
    }

    private static List<List<String>> padRows(Path file, int width, List<List<String>> data) {
        List<List<String>> rows = new ArrayList<>(data.size());
        for (int r = 0; r < data.size(); r++) {
            List<String> row = data.get(r);
            if (row.size() > width) {
                throw new SlicerConfigException(
                        "Data row " + r + " of " + file + " has " + row.size() + " fields, expected " + width);
            }
            List<String> padded = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                padded.add(c < row.size() && row.get(c) != null ? row.get(c) : "");
            }
            rows.add(padded);
        }
        return rows;
    }

    private static CsvTable dropUnnamedColumns(CsvTable table) {
        List<Integer> keep = IntStream.range(0, table.columns().size())
                .filter(i -> !table.columns().get(i).startsWith(UNNAMED_PREFIX))
                .boxed()
                .toList();
        return keep.size() == table.columns().size() ? table : table.project(keep);
    }

    private static CsvTable assignColumnNames(Path file, CsvTable table, List<String> columnNames) {
        if (columnNames.size() != table.columns().size()) {
            throw new SlicerConfigException("Got " + columnNames.size() + " column names for " + table.columns().size()
                    + " columns in " + file);
        }
        return new CsvTable(columnNames, table.rows());
    }
}
