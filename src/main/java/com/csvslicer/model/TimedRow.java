package com.csvslicer.model;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * One row of an {@link IndexedTable}: its zone-aware timestamp and the remaining cells by column name.
 */
public record TimedRow(ZonedDateTime timestamp, Map<String, String> values) {

    public TimedRow withTimestamp(ZonedDateTime newTimestamp) {
        return new TimedRow(newTimestamp, values);
    }
}
