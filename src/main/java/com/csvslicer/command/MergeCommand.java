package com.csvslicer.command;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.io.CsvTableWriter;
import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.CsvTable;
import com.csvslicer.model.SkipRows;
import com.csvslicer.model.SortSpec;
import com.csvslicer.utils.SourceFileUtils;
import com.csvslicer.utils.TimeFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges files sharing a column layout into one, sorted on a column and deduplicated on another.
 * Column names of the first file apply to every file.
 */
@Component
public class MergeCommand implements CsvCommand {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    public static final String NAME = "merge";

    private static final CsvReadOptions MERGE_READ_OPTIONS = new CsvReadOptions(0, new SkipRows.None(), List.of(), true);

    private final MergeOptions options;
    private final CsvTableReader reader;
    private final CsvTableWriter writer;
    private final Clock clock;

    public MergeCommand(MergeOptions options, CsvTableReader reader, CsvTableWriter writer, Clock clock) {
        this.options = options;
        this.reader = reader;
        this.writer = writer;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int execute() throws IOException {
        int keyColumn = options.columnIndex();
        SortSpec sort = options.sortSpec();
        Path output = outputPath(options.output());

        List<Path> files = SourceFileUtils.resolveAll(options.sourceList());
        if (files.size() < 2) {
            throw new SlicerConfigException("Merge needs at least two source files, found " + files);
        }

        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        for (Path file : files) {
            CsvTable table = reader.read(file, MERGE_READ_OPTIONS);
            if (header == null) {
                header = table.columns();
            } else if (table.columns().size() != header.size()) {
                throw new SlicerConfigException(file + " has " + table.columns().size() + " columns, expected "
                        + header.size() + " like " + files.get(0));
            }
            rows.addAll(table.rows());
            log.debug("Merging {} rows from {}", table.size(), file);
        }
        checkColumn(header, keyColumn, "merge.column");
        checkColumn(header, sort.column(), "merge.sort");

        List<String> sortValues = rows.stream().map(row -> row.get(sort.column())).toList();
        Comparator<List<String>> order = Comparator.comparing(row -> row.get(sort.column()), cellOrder(sortValues));
        rows.sort(sort.ascending() ? order : order.reversed());

        Set<String> seen = new HashSet<>();
        List<List<String>> unique = new ArrayList<>();
        for (List<String> row : rows) {
            if (seen.add(row.get(keyColumn))) {
                unique.add(keyFirst(row, keyColumn));
            }
        }

        writer.write(output, keyFirst(header, keyColumn), unique);
        log.info("Merged {} files into {}: {} rows, {} duplicates dropped", files.size(), output, unique.size(),
                rows.size() - unique.size());
        return 0;
    }

    /**
     * Resolves time directives in the output path against the current time.
     */
    Path outputPath(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new SlicerConfigException("Option 'merge.output' is required");
        }
        if (!pattern.contains("%")) {
            return Path.of(pattern.strip());
        }
        try {
            return Path.of(TimeFormatUtils.format(ZonedDateTime.now(clock), pattern.strip()));
        } catch (DateTimeException e) {
            throw new SlicerConfigException("Cannot resolve output path '" + pattern + "'", e);
        }
    }

    /**
     * Numeric order when every value of the column is a number, text order otherwise. Decided once per column, so a
     * mixed column sorts entirely as text.
     */
    static Comparator<String> cellOrder(List<String> columnValues) {
        boolean numeric = !columnValues.isEmpty() && columnValues.stream().allMatch(value -> toNumber(value) != null);
        if (numeric) {
            return Comparator.comparing(MergeCommand::toNumber);
        }
        return Comparator.naturalOrder();
    }

    private static BigDecimal toNumber(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> keyFirst(List<String> row, int keyColumn) {
        List<String> reordered = new ArrayList<>(row.size());
        reordered.add(row.get(keyColumn));
        for (int c = 0; c < row.size(); c++) {
            if (c != keyColumn) {
                reordered.add(row.get(c));
            }
        }
        return reordered;
    }

    private static void checkColumn(List<String> header, int column, String option) {
        if (column < 0 || column >= header.size()) {
            throw new SlicerConfigException("Option '" + option + "' refers to column " + column + " but files have "
                    + header.size() + " columns");
        }
    }
}
