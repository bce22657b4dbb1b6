package com.csvslicer.time;

import com.csvslicer.exception.TimestampFormatException;
import com.csvslicer.model.IndexTimestamp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampNormalizerTest {

    private static final String FORMAT = "%Y-%m-%d %H:%M:%S";

    private final TimestampNormalizer normalizer = new TimestampNormalizer();

    @Test
    @DisplayName("Parses a well-formed naive timestamp")
    void normalize_parsesNaiveValue() {
        IndexTimestamp parsed = normalizer.normalize("2024-05-01 10:15:00", FORMAT);

        assertThat(parsed.isAware()).isFalse();
        assertThat(parsed.wallClock()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 15));
    }

    @Test
    @DisplayName("24:00 rolls over to midnight of the next day")
    void normalize_correctsColonRollover() {
        IndexTimestamp parsed = normalizer.normalize("2024-05-01 24:00:00", FORMAT);

        assertThat(parsed.wallClock()).isEqualTo(LocalDateTime.of(2024, 5, 2, 0, 0));
    }

    @Test
    @DisplayName("2400 rolls over to midnight of the next day")
    void normalize_correctsCompactRollover() {
        IndexTimestamp parsed = normalizer.normalize("202412312400", "%Y%m%d%H%M");

        assertThat(parsed.wallClock()).isEqualTo(LocalDateTime.of(2025, 1, 1, 0, 0));
    }

    @Test
    @DisplayName("Keeps the zone when the format carries an offset")
    void normalize_keepsOffset() {
        IndexTimestamp parsed = normalizer.normalize("2024-05-01T10:00:00+0200", "%Y-%m-%dT%H:%M:%S%z");

        assertThat(parsed.isAware()).isTrue();
        assertThat(parsed.toZonedDateTime().toInstant())
                .isEqualTo(ZonedDateTime.of(2024, 5, 1, 8, 0, 0, 0, ZoneOffset.UTC).toInstant());
    }

    @Test
    @DisplayName("Blank format accepts ISO-8601 values")
    void normalize_blankFormatUsesIso() {
        IndexTimestamp parsed = normalizer.normalize("2024-05-01T24:00:00Z", "");

        assertThat(parsed.toZonedDateTime()).isEqualTo(ZonedDateTime.of(2024, 5, 2, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Values that are not a rollover fail with the raw value and format")
    void normalize_failsOnMalformedValue() {
        assertThatThrownBy(() -> normalizer.normalize("2024-05-01 24:30:00", FORMAT))
                .isInstanceOfSatisfying(TimestampFormatException.class, e -> {
                    assertThat(e.rawValue()).isEqualTo("2024-05-01 24:30:00");
                    assertThat(e.format()).isEqualTo(FORMAT);
                    assertThat(e.rowNumber()).isEqualTo(TimestampFormatException.UNKNOWN_ROW);
                });
    }

    @Test
    @DisplayName("A rollover that still does not parse after correction fails")
    void normalize_failsWhenCorrectionDoesNotParse() {
        assertThatThrownBy(() -> normalizer.normalize("2024-05-01 24:00:61", FORMAT))
                .isInstanceOf(TimestampFormatException.class)
                .hasMessageContaining("2024-05-01 24:00:61");
    }

    @Test
    @DisplayName("Missing values fail instead of producing nulls")
    void normalize_failsOnNull() {
        assertThatThrownBy(() -> normalizer.normalize(null, FORMAT)).isInstanceOf(TimestampFormatException.class);
    }

    @Test
    @DisplayName("Column normalization reports the failing row")
    void normalizeAll_reportsRow() {
        List<String> column = List.of("2024-05-01 10:00:00", "2024-05-01 11:00:00", "not a date");

        assertThatThrownBy(() -> normalizer.normalizeAll(column, FORMAT))
                .isInstanceOfSatisfying(TimestampFormatException.class, e -> assertThat(e.rowNumber()).isEqualTo(2))
                .hasMessageContaining("data row 2");
    }
}
