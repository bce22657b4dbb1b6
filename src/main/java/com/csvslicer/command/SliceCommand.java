package com.csvslicer.command;

import com.csvslicer.exception.BucketWriteException;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.model.BucketPlan;
import com.csvslicer.model.BucketWriteReport;
import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.CsvTable;
import com.csvslicer.model.IndexColumnSpec;
import com.csvslicer.model.IndexedTable;
import com.csvslicer.model.TimezoneSpec;
import com.csvslicer.slicer.BucketKeyDeriver;
import com.csvslicer.slicer.BucketMergeWriter;
import com.csvslicer.slicer.TimeIndexer;
import com.csvslicer.utils.SourceFileUtils;
import com.csvslicer.utils.TimeFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Slices source files into per-interval bucket files, merging with buckets written by earlier runs.
 */
@Component
public class SliceCommand implements CsvCommand {

    private static final Logger log = LoggerFactory.getLogger(SliceCommand.class);

    public static final String NAME = "slice";

    private final SliceOptions options;
    private final IngestOptions ingestOptions;
    private final CsvTableReader reader;
    private final TimeIndexer indexer;
    private final BucketKeyDeriver deriver;
    private final BucketMergeWriter writer;

    public SliceCommand(SliceOptions options,
                        IngestOptions ingestOptions,
                        CsvTableReader reader,
                        TimeIndexer indexer,
                        BucketKeyDeriver deriver,
                        BucketMergeWriter writer) {
        this.options = options;
        this.ingestOptions = ingestOptions;
        this.reader = reader;
        this.indexer = indexer;
        this.deriver = deriver;
        this.writer = writer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int execute() throws IOException {
        IndexColumnSpec indexColumn = options.indexColumnSpec();
        String pathFormat = options.requiredPathFormat();
        String groupFormat = options.groupFormat();
        Optional<TimezoneSpec> timezone = options.timezone();
        Path outputRoot = options.outputRoot();
        List<String> dropColumns = options.dropColumnList();
        CsvReadOptions readOptions = ingestOptions.toReadOptions();
        TimeFormatUtils.compile(options.dateFormatOut());

        boolean bucketsFailed = false;
        for (Path source : SourceFileUtils.resolve(options.source())) {
            CsvTable table = reader.read(source, readOptions);
            if (!dropColumns.isEmpty()) {
                table = table.dropColumns(dropColumns);
            }
            IndexedTable indexed = indexer.index(table, indexColumn, options.inFormat(), timezone);
            BucketPlan plan = deriver.derive(indexed.timestamps(), pathFormat, groupFormat, outputRoot);
            BucketWriteReport report = writer.writeBuckets(indexed, plan, options.dateFormatOut());

            log.info("Sliced {} rows of {} into {} buckets under {}", table.size(), source, plan.buckets().size(), outputRoot);
            if (report.hasFailures()) {
                log.error("{} buckets of {} failed: {}", report.failures().size(), source,
                        report.failures().stream().map(BucketWriteException::bucketPath).toList());
                bucketsFailed = true;
            }
        }
        return bucketsFailed ? BucketWriteException.EXIT_CODE : 0;
    }
}
