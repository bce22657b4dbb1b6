package com.csvslicer.time;

import com.csvslicer.exception.TimezoneException;
import com.csvslicer.model.IndexTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves index values into a destination zone. Naive values are shifted and localized, aware values are converted.
 */
@Component
public class TimezoneAdjuster {

    private static final Logger log = LoggerFactory.getLogger(TimezoneAdjuster.class);

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    /**
     * Shifts naive values by {@code hours} and localizes them in {@code destinationZone}; aware values are
     * converted to the zone without a shift. Output order matches input order.
     */
    public List<ZonedDateTime> adjust(List<IndexTimestamp> index, double hours, String destinationZone) {
        ZoneId zone = zoneOf(destinationZone);
        Duration shift = hoursToDuration(hours);

        List<ZonedDateTime> adjusted = new ArrayList<>(index.size());
        int naive = 0;
        for (IndexTimestamp timestamp : index) {
            if (timestamp.isAware()) {
                adjusted.add(timestamp.toZonedDateTime().withZoneSameInstant(zone));
            } else {
                adjusted.add(localize(timestamp.wallClock().plus(shift), zone));
                naive++;
            }
        }
        if (naive > 0 && naive < index.size()) {
            log.warn("Index mixes zone-aware and naive values, shifted {} naive values by {}h into {}", naive, hours, zone);
        }
        return adjusted;
    }

    /**
     * Attaches {@code zoneLabel} to naive values without changing their wall-clock time.
     *
     * @throws TimezoneException if any value already carries a zone
     */
    public List<ZonedDateTime> localize(List<IndexTimestamp> index, String zoneLabel) {
        ZoneId zone = zoneOf(zoneLabel);
        List<ZonedDateTime> localized = new ArrayList<>(index.size());
        for (IndexTimestamp timestamp : index) {
            if (timestamp.isAware()) {
                throw new TimezoneException("Cannot localize " + timestamp + " to " + zone
                        + ": it is already zone-aware, convert it instead");
            }
            localized.add(localize(timestamp.wallClock(), zone));
        }
        return localized;
    }

    /**
     * Treats naive values as already being in {@code zoneLabel}; aware values are kept unchanged.
     */
    public List<ZonedDateTime> assume(List<IndexTimestamp> index, String zoneLabel) {
        ZoneId zone = zoneOf(zoneLabel);
        return index.stream()
                .map(timestamp -> timestamp.isAware() ? timestamp.toZonedDateTime() : localize(timestamp.wallClock(), zone))
                .toList();
    }

    public static ZoneId zoneOf(String label) {
        if (label == null || label.isBlank()) {
            throw new TimezoneException("A timezone label is required");
        }
        try {
            return ZoneId.of(label.strip());
        } catch (DateTimeException e) {
            throw new TimezoneException("Unrecognized timezone '" + label + "'", e);
        }
    }

    /**
     * Localizes a wall-clock time, rejecting times skipped or repeated by a daylight saving transition.
     */
    public static ZonedDateTime localize(LocalDateTime wallClock, ZoneId zone) {
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(wallClock);
        if (offsets.isEmpty()) {
            throw new TimezoneException("Local time " + wallClock + " does not exist in " + zone);
        }
        if (offsets.size() > 1) {
            throw new TimezoneException("Local time " + wallClock + " is ambiguous in " + zone);
        }
        return ZonedDateTime.ofLocal(wallClock, zone, offsets.get(0));
    }

    private static Duration hoursToDuration(double hours) {
        if (!Double.isFinite(hours)) {
            throw new TimezoneException("Hour offset must be a finite number, got " + hours);
        }
        return Duration.ofMillis(Math.round(hours * MILLIS_PER_HOUR));
    }
}
