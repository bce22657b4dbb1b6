package com.csvslicer.model;

import com.csvslicer.exception.SlicerConfigException;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which physical records of a CSV file are ignored before the header row is selected.
 */
public sealed interface SkipRows permits SkipRows.None, SkipRows.SingleOffset, SkipRows.RowList {

    boolean skips(int recordIndex);

    /**
     * Parses the {@code data-begins} option: blank for none, {@code n} to skip the first n records, or a comma
     * separated list of 0-based record numbers.
     */
    static SkipRows parse(String value) {
        if (value == null || value.isBlank()) {
            return new None();
        }
        String trimmed = value.strip();
        try {
            if (!trimmed.contains(",")) {
                return new SingleOffset(Integer.parseInt(trimmed));
            }
            Set<Integer> rows = Arrays.stream(trimmed.split(","))
                    .map(String::strip)
                    .map(Integer::parseInt)
                    .collect(Collectors.toUnmodifiableSet());
            return new RowList(rows);
        } catch (NumberFormatException e) {
            throw new SlicerConfigException("Invalid skip rows '" + value + "', expected a count or a list of row numbers", e);
        }
    }

    record None() implements SkipRows {
        @Override
        public boolean skips(int recordIndex) {
            return false;
        }
    }

    record SingleOffset(int count) implements SkipRows {
        public SingleOffset {
            if (count < 0) {
                throw new SlicerConfigException("Skip row count must not be negative: " + count);
            }
        }

        @Override
        public boolean skips(int recordIndex) {
            return recordIndex < count;
        }
    }

    record RowList(Set<Integer> rows) implements SkipRows {
        public RowList {
            rows = Set.copyOf(rows);
        }

        @Override
        public boolean skips(int recordIndex) {
            return rows.contains(recordIndex);
        }
    }
}
