package com.csvslicer.model;

import com.csvslicer.exception.TimezoneException;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A parsed index value: a wall-clock date-time that is either naive (no zone) or aware (zone attached).
 */
public final class IndexTimestamp {

    private final LocalDateTime wallClock;
    private final ZonedDateTime zoned;

    private IndexTimestamp(LocalDateTime wallClock, ZonedDateTime zoned) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zoned = zoned;
    }

    public static IndexTimestamp naive(LocalDateTime wallClock) {
        return new IndexTimestamp(wallClock, null);
    }

    public static IndexTimestamp aware(ZonedDateTime zoned) {
        return new IndexTimestamp(zoned.toLocalDateTime(), zoned);
    }

    public boolean isAware() {
        return zoned != null;
    }

    public LocalDateTime wallClock() {
        return wallClock;
    }

    public ZonedDateTime toZonedDateTime() {
        if (zoned == null) {
            throw new TimezoneException("Timestamp " + wallClock + " has no zone attached");
        }
        return zoned;
    }

    public IndexTimestamp plusDays(long days) {
        return zoned == null ? naive(wallClock.plusDays(days)) : aware(zoned.plusDays(days));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexTimestamp other)) {
            return false;
        }
        return wallClock.equals(other.wallClock) && Objects.equals(zoned, other.zoned);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wallClock, zoned);
    }

    @Override
    public String toString() {
        return zoned == null ? wallClock.toString() : zoned.toString();
    }
}
