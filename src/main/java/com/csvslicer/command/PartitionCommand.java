package com.csvslicer.command;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.io.CsvTableWriter;
import com.csvslicer.utils.SourceFileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits files into {@code <output>/<value>.csv} by the value of one column, e.g. for files that interleave
 * several message types. Records are copied verbatim, header lines included.
 */
@Component
public class PartitionCommand implements CsvCommand {

    private static final Logger log = LoggerFactory.getLogger(PartitionCommand.class);

    public static final String NAME = "partition";

    private final PartitionOptions options;
    private final CsvTableReader reader;
    private final CsvTableWriter writer;

    public PartitionCommand(PartitionOptions options, CsvTableReader reader, CsvTableWriter writer) {
        this.options = options;
        this.reader = reader;
        this.writer = writer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int execute() throws IOException {
        int column = options.columnIndex();
        Path outputRoot = options.outputRoot();
        if (column < 0) {
            throw new SlicerConfigException("Option 'partition.column' must not be negative");
        }

        Map<String, List<List<String>>> partitions = new LinkedHashMap<>();
        for (Path source : SourceFileUtils.resolve(options.source())) {
            List<List<String>> records = reader.readRecords(source);
            for (int i = 0; i < records.size(); i++) {
                List<String> record = records.get(i);
                String value = column < record.size() && record.get(column) != null ? record.get(column).strip() : "";
                if (value.isEmpty()) {
                    throw new SlicerConfigException("Record " + i + " of " + source + " has no value in column " + column);
                }
                partitions.computeIfAbsent(value, key -> new ArrayList<>()).add(record);
            }
        }

        for (Map.Entry<String, List<List<String>>> partition : partitions.entrySet()) {
            Path target = outputRoot.resolve(partition.getKey() + ".csv");
            writer.write(target, null, partition.getValue());
            log.debug("Wrote {} records to {}", partition.getValue().size(), target);
        }
        log.info("Partitioned {} into {} files under {}", options.source(), partitions.size(), outputRoot);
        return 0;
    }
}
