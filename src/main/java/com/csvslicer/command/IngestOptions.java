package com.csvslicer.command;

import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.SkipRows;
import com.csvslicer.utils.OptionUtils;

/**
 * Raw {@code csv.*} options, parsed when a command runs.
 */
public record IngestOptions(String names, String dataBegins, String columnNames, boolean keepEmptyColumns) {

    public CsvReadOptions toReadOptions() {
        return new CsvReadOptions(
                OptionUtils.parseInt(names, "csv.names"),
                SkipRows.parse(dataBegins),
                OptionUtils.splitList(columnNames),
                keepEmptyColumns);
    }
}
