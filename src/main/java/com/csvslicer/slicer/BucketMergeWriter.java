package com.csvslicer.slicer;

import com.csvslicer.exception.BucketWriteException;
import com.csvslicer.exception.CsvSlicerException;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.io.CsvTableWriter;
import com.csvslicer.model.Bucket;
import com.csvslicer.model.BucketPlan;
import com.csvslicer.model.BucketWriteReport;
import com.csvslicer.model.CsvReadOptions;
import com.csvslicer.model.CsvTable;
import com.csvslicer.model.IndexTimestamp;
import com.csvslicer.model.IndexedTable;
import com.csvslicer.model.SkipRows;
import com.csvslicer.model.TimedRow;
import com.csvslicer.time.TimestampNormalizer;
import com.csvslicer.time.TimezoneAdjuster;
import com.csvslicer.utils.TimeFormatUtils;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes each bucket of a plan by merging the new rows into whatever the bucket file already holds.
 * <p>
 * Per bucket: load existing rows, append the new ones, floor timestamps to the minute, keep the first row for each
 * timestamp, sort ascending and replace the file. A bucket that fails is reported and the remaining buckets are
 * still written. Runs against the same output directory must not overlap: the merge is read-modify-write.
 * <p>
 * Timestamps are rendered in the zone they were bucketed in, so a row never carries a different calendar day than
 * the file it lands in. Rows loaded from an existing file keep the offset they were written with.
 * <p>
 * Flooring also applies when the bucket file does not exist yet, unlike a plain "absent file, skip to dedup" merge,
 * so that rerunning the same sub-minute input leaves the file unchanged. Disable it with
 * {@code slicer.floor-to-minute=false}.
 */
@Component
public class BucketMergeWriter {

    private static final Logger log = LoggerFactory.getLogger(BucketMergeWriter.class);

    private static final String METRIC_BUCKET_WRITES = "bucket.writes";
    private static final String METRIC_BUCKET_ERRORS = "bucket.errors";
    private static final String TAG_MODE = "mode";

    private static final CsvReadOptions BUCKET_READ_OPTIONS =
            new CsvReadOptions(0, new SkipRows.None(), List.of(), true);

    private final CsvTableReader reader;
    private final CsvTableWriter writer;
    private final TimestampNormalizer normalizer;
    private final boolean floorToMinute;

    public BucketMergeWriter(CsvTableReader reader,
                             CsvTableWriter writer,
                             TimestampNormalizer normalizer,
                             @Value("${slicer.floor-to-minute:true}") boolean floorToMinute) {
        this.reader = reader;
        this.writer = writer;
        this.normalizer = normalizer;
        this.floorToMinute = floorToMinute;
    }

    /**
     * @param dateOutputFormat strftime format used to render and to re-read the index column of bucket files
     */
    public BucketWriteReport writeBuckets(IndexedTable table, BucketPlan plan, String dateOutputFormat) {
        DateTimeFormatter outputFormatter = TimeFormatUtils.compile(dateOutputFormat);
        List<Path> written = new ArrayList<>();
        List<BucketWriteException> failures = new ArrayList<>();

        for (Bucket bucket : plan.buckets()) {
            try {
                String mode = writeBucket(table, bucket, dateOutputFormat, outputFormatter);
                written.add(bucket.path());
                Metrics.counter(METRIC_BUCKET_WRITES, TAG_MODE, mode).increment();
            } catch (BucketWriteException e) {
                Metrics.counter(METRIC_BUCKET_ERRORS).increment();
                log.error("Failed to write bucket {} ({} new rows), continuing with remaining buckets",
                        bucket.groupKey(), bucket.rowPositions().size(), e);
                failures.add(e);
            }
        }
        log.info("Wrote {} of {} buckets", written.size(), plan.buckets().size());
        return new BucketWriteReport(written, failures);
    }

    private String writeBucket(IndexedTable table, Bucket bucket, String dateOutputFormat,
                               DateTimeFormatter outputFormatter) {
        Path path = bucket.path();
        List<String> columns = new ArrayList<>();
        List<TimedRow> merged = new ArrayList<>();

        boolean exists = Files.exists(path);
        if (exists) {
            CsvTable existing = loadExisting(path);
            int indexPosition = existing.columnIndex(table.indexColumn());
            if (indexPosition < 0) {
                throw new BucketWriteException(path, "index column '" + table.indexColumn() + "' missing from existing file");
            }
            columns.addAll(existing.columns());
            columns.remove(indexPosition);
            merged.addAll(toTimedRows(path, existing, indexPosition, dateOutputFormat, table.zone()));
        }
        for (String column : table.columns()) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        merged.addAll(table.select(bucket.rowPositions()));

        List<TimedRow> rows = sortByTimestamp(deduplicate(floorToMinute ? floor(merged) : merged));
        persist(path, table, columns, rows, outputFormatter);

        log.debug("Bucket {}: {} rows written to {} ({} existing)", bucket.groupKey(), rows.size(), path,
                exists ? "merged with" : "no");
        return exists ? "merged" : "created";
    }

    private CsvTable loadExisting(Path path) {
        try {
            return reader.read(path, BUCKET_READ_OPTIONS);
        } catch (IOException | CsvSlicerException e) {
            throw new BucketWriteException(path, "unable to read existing file", e);
        }
    }

    private List<TimedRow> toTimedRows(Path path, CsvTable existing, int indexPosition, String dateOutputFormat,
                                       ZoneId zone) {
        List<TimedRow> rows = new ArrayList<>(existing.size());
        for (int r = 0; r < existing.size(); r++) {
            List<String> cells = existing.rows().get(r);
            ZonedDateTime timestamp;
            try {
                IndexTimestamp parsed = normalizer.normalize(cells.get(indexPosition), dateOutputFormat);
                timestamp = parsed.isAware() ? parsed.toZonedDateTime() : TimezoneAdjuster.localize(parsed.wallClock(), zone);
            } catch (CsvSlicerException e) {
                throw new BucketWriteException(path, "unparsable timestamp in existing data row " + r, e);
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < cells.size(); c++) {
                if (c != indexPosition) {
                    values.put(existing.columns().get(c), cells.get(c));
                }
            }
            rows.add(new TimedRow(timestamp, values));
        }
        return rows;
    }

    private static List<TimedRow> floor(List<TimedRow> rows) {
        return rows.stream()
                .map(row -> row.withTimestamp(row.timestamp().truncatedTo(ChronoUnit.MINUTES)))
                .toList();
    }

    /**
     * Keeps the first row seen for each instant, so rows already on disk win over new ones.
     */
    static List<TimedRow> deduplicate(List<TimedRow> rows) {
        Map<Instant, TimedRow> unique = new LinkedHashMap<>();
        for (TimedRow row : rows) {
            unique.putIfAbsent(row.timestamp().toInstant(), row);
        }
        return new ArrayList<>(unique.values());
    }

    static List<TimedRow> sortByTimestamp(List<TimedRow> rows) {
        List<TimedRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing((TimedRow row) -> row.timestamp().toInstant()));
        return sorted;
    }

    private void persist(Path path, IndexedTable table, List<String> columns, List<TimedRow> rows,
                         DateTimeFormatter outputFormatter) {
        List<String> header = new ArrayList<>(columns.size() + 1);
        header.add(table.indexColumn());
        header.addAll(columns);

        List<List<String>> cells = new ArrayList<>(rows.size());
        try {
            for (TimedRow row : rows) {
                List<String> line = new ArrayList<>(header.size());
                line.add(outputFormatter.format(row.timestamp()));
                for (String column : columns) {
                    line.add(row.values().getOrDefault(column, ""));
                }
                cells.add(line);
            }
        } catch (DateTimeException e) {
            throw new BucketWriteException(path, "cannot render timestamps with the output format", e);
        }

        try {
            writer.write(path, header, cells);
        } catch (IOException e) {
            throw new BucketWriteException(path, "unable to write bucket file", e);
        }
    }
}
