package com.csvslicer.command;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.io.CsvTableWriter;
import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.CsvTable;
import com.csvslicer.model.DateColumnSpec;
import com.csvslicer.model.IndexTimestamp;
import com.csvslicer.model.TimezoneSpec;
import com.csvslicer.time.TimestampNormalizer;
import com.csvslicer.time.TimezoneAdjuster;
import com.csvslicer.utils.OptionUtils;
import com.csvslicer.utils.SourceFileUtils;
import com.csvslicer.utils.TimeFormatUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites the timestamp column of one or more files into a new format, repairing 24:00 values and optionally
 * shifting them into another zone.
 */
@Component
public class ConvertDateCommand implements CsvCommand {

    private static final Logger log = LoggerFactory.getLogger(ConvertDateCommand.class);

    public static final String NAME = "convert-date";

    private final ConvertOptions options;
    private final IngestOptions ingestOptions;
    private final CsvTableReader reader;
    private final CsvTableWriter writer;
    private final TimestampNormalizer normalizer;
    private final TimezoneAdjuster adjuster;
    private final ObjectMapper objectMapper;

    public ConvertDateCommand(ConvertOptions options,
                              IngestOptions ingestOptions,
                              CsvTableReader reader,
                              CsvTableWriter writer,
                              TimestampNormalizer normalizer,
                              TimezoneAdjuster adjuster,
                              @Qualifier("jsonObjectMapper") ObjectMapper objectMapper) {
        this.options = options;
        this.ingestOptions = ingestOptions;
        this.reader = reader;
        this.writer = writer;
        this.normalizer = normalizer;
        this.adjuster = adjuster;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int execute() throws IOException {
        String column = OptionUtils.require(options.column(), "convert.column");
        DateColumnSpec dateColumn = DateColumnSpec.parse(options.timestamp(), objectMapper);
        DateTimeFormatter outFormatter = TimeFormatUtils.compile(options.outFormat());
        Optional<TimezoneSpec> timezone = options.timezone();
        int position = options.positionIndex();
        List<String> dropColumns = options.dropColumnList();
        CsvReadOptions readOptions = ingestOptions.toReadOptions();
        Path outputRoot = Path.of(OptionUtils.require(options.output(), "convert.output"));

        List<Path> sources = SourceFileUtils.resolve(options.source());
        boolean fixedName = options.filenameFormat() != null && !options.filenameFormat().isBlank();
        if (fixedName && sources.size() > 1) {
            throw new SlicerConfigException("convert.filename-format names a single file but " + sources.size()
                    + " sources matched " + options.source());
        }

        for (Path source : sources) {
            CsvTable table = reader.read(source, readOptions);

            boolean convert = true;
            if (dateColumn instanceof DateColumnSpec.Combine combine) {
                table = table.insertColumn(position, column, combineColumns(table, combine.columns()));
            } else if (dateColumn instanceof DateColumnSpec.Flag flag) {
                table.requireColumn(column);
                convert = flag.enabled();
            }

            if (convert) {
                List<IndexTimestamp> parsed = normalizer.normalizeAll(table.column(column), options.inFormat());
                table = table.withColumnValues(column, render(parsed, timezone, outFormatter));
            }
            if (!dropColumns.isEmpty()) {
                table = table.dropColumns(dropColumns);
            }

            Path target = outputRoot.resolve(fixedName ? options.filenameFormat().strip() : source.getFileName().toString());
            writer.write(target, table.columns(), table.rows());
            log.info("Converted {} rows of {} into {}", table.size(), source, target);
        }
        return 0;
    }

    private static List<String> combineColumns(CsvTable table, List<String> columns) {
        List<Integer> positions = columns.stream().map(table::requireColumn).toList();
        List<String> combined = new ArrayList<>(table.size());
        for (List<String> row : table.rows()) {
            combined.add(String.join(" ", positions.stream().map(row::get).toList()));
        }
        return combined;
    }

    private List<String> render(List<IndexTimestamp> parsed, Optional<TimezoneSpec> timezone, DateTimeFormatter formatter) {
        try {
            if (timezone.isPresent()) {
                return adjuster.adjust(parsed, timezone.get().hours(), timezone.get().zone()).stream()
                        .map(formatter::format)
                        .toList();
            }
            return parsed.stream()
                    .map(timestamp -> timestamp.isAware()
                            ? formatter.format(timestamp.toZonedDateTime())
                            : formatter.format(timestamp.wallClock()))
                    .toList();
        } catch (DateTimeException e) {
            throw new SlicerConfigException("Output format '" + options.outFormat()
                    + "' needs zone information the timestamps do not carry, set convert.adjust-tz", e);
        }
    }
}
