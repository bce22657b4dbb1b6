package com.csvslicer.time;

import com.csvslicer.exception.TimestampFormatException;
import com.csvslicer.model.IndexTimestamp;
import com.csvslicer.utils.TimeFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses raw timestamp strings, repairing "24:00" end-of-day values into midnight of the following day.
 */
@Component
public class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    private static final String[][] ROLLOVERS = {
            {"2400", "0000"},
            {"24:00", "00:00"}
    };

    /**
     * Parses {@code raw} with a strftime {@code format}; a blank format accepts ISO-8601 values.
     *
     * @throws TimestampFormatException if the value does not parse and is not a repairable rollover
     */
    public IndexTimestamp normalize(String raw, String format) {
        DateTimeFormatter formatter = TimeFormatUtils.formatterOrIso(format);
        String label = format == null || format.isBlank() ? TimeFormatUtils.ISO_TIMESTAMP_LABEL : format;
        if (raw == null) {
            throw new TimestampFormatException(null, label, null);
        }

        String value = raw.strip();
        try {
            return parse(value, formatter);
        } catch (DateTimeException e) {
            for (String[] rollover : ROLLOVERS) {
                int at = value.indexOf(rollover[0]);
                if (at < 0) {
                    continue;
                }
                String corrected = value.substring(0, at) + rollover[1] + value.substring(at + rollover[0].length());
                try {
                    IndexTimestamp repaired = parse(corrected, formatter).plusDays(1);
                    log.warn("Auto-correcting rollover timestamp '{}' ({}) to {}", raw, label, repaired);
                    return repaired;
                } catch (DateTimeException retry) {
                    TimestampFormatException failure = new TimestampFormatException(raw, label, retry);
                    failure.addSuppressed(e);
                    throw failure;
                }
            }
            throw new TimestampFormatException(raw, label, e);
        }
    }

    /**
     * Normalizes a whole column; failures report the 0-based data row.
     */
    public List<IndexTimestamp> normalizeAll(List<String> rawValues, String format) {
        List<IndexTimestamp> normalized = new ArrayList<>(rawValues.size());
        for (int row = 0; row < rawValues.size(); row++) {
            try {
                normalized.add(normalize(rawValues.get(row), format));
            } catch (TimestampFormatException e) {
                throw e.atRow(row);
            }
        }
        return normalized;
    }

    private static IndexTimestamp parse(String value, DateTimeFormatter formatter) {
        TemporalAccessor parsed = formatter.parse(value);
        ZoneId zone = parsed.query(TemporalQueries.zone());
        if (zone != null) {
            return IndexTimestamp.aware(ZonedDateTime.from(parsed));
        }
        return IndexTimestamp.naive(LocalDateTime.from(parsed));
    }
}
