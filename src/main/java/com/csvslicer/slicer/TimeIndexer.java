package com.csvslicer.slicer;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.model.CsvTable;
import com.csvslicer.model.IndexColumnSpec;
import com.csvslicer.model.IndexTimestamp;
import com.csvslicer.model.IndexedTable;
import com.csvslicer.model.TimedRow;
import com.csvslicer.model.TimezoneSpec;
import com.csvslicer.time.TimestampNormalizer;
import com.csvslicer.time.TimezoneAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the index column of a raw table into zone-aware timestamps, ready for bucketing.
 */
@Component
public class TimeIndexer {

    private static final Logger log = LoggerFactory.getLogger(TimeIndexer.class);

    static final String DEFAULT_ZONE = ZoneOffset.UTC.getId();

    private final TimestampNormalizer normalizer;
    private final TimezoneAdjuster adjuster;

    public TimeIndexer(TimestampNormalizer normalizer, TimezoneAdjuster adjuster) {
        this.normalizer = normalizer;
        this.adjuster = adjuster;
    }

    /**
     * @param inFormat strftime format of the index values, blank for ISO-8601
     * @param timezone optional shift and destination zone; without one naive values are taken as UTC
     */
    public IndexedTable index(CsvTable table, IndexColumnSpec indexColumn, String inFormat,
                              Optional<TimezoneSpec> timezone) {
        int indexPosition = table.requireColumn(indexColumn.name());
        String outputName = indexColumn.outputName();
        if (!outputName.equals(indexColumn.name()) && table.columnIndex(outputName) >= 0) {
            throw new SlicerConfigException("Cannot rename index column to '" + outputName + "': column already exists");
        }

        List<IndexTimestamp> parsed = normalizer.normalizeAll(table.column(indexColumn.name()), inFormat);

        List<ZonedDateTime> timestamps;
        ZoneId zone;
        if (timezone.isPresent()) {
            TimezoneSpec spec = timezone.get();
            timestamps = adjuster.adjust(parsed, spec.hours(), spec.zone());
            zone = TimezoneAdjuster.zoneOf(spec.zone());
        } else {
            timestamps = adjuster.assume(parsed, DEFAULT_ZONE);
            zone = TimezoneAdjuster.zoneOf(DEFAULT_ZONE);
        }

        List<String> columns = new ArrayList<>(table.columns());
        columns.remove(indexPosition);

        List<TimedRow> rows = new ArrayList<>(table.size());
        for (int r = 0; r < table.size(); r++) {
            List<String> cells = table.rows().get(r);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < cells.size(); c++) {
                if (c != indexPosition) {
                    values.put(table.columns().get(c), cells.get(c));
                }
            }
            rows.add(new TimedRow(timestamps.get(r), values));
        }
        log.debug("Indexed {} rows on '{}' in zone {}", rows.size(), outputName, zone);
        return new IndexedTable(outputName, columns, rows, zone);
    }
}
