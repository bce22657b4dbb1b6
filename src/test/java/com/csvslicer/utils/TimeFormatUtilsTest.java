package com.csvslicer.utils;

import com.csvslicer.exception.SlicerConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeFormatUtilsTest {

    private static final ZonedDateTime TIMESTAMP = ZonedDateTime.of(2024, 5, 2, 7, 8, 9, 0, ZoneOffset.UTC);

    @Test
    @DisplayName("Formats dates with literal text around directives")
    void format_expandsDirectivesAndLiterals() {
        assertThat(TimeFormatUtils.format(TIMESTAMP, "%Y/%m/data_%Y%m%d.csv")).isEqualTo("2024/05/data_20240502.csv");
        assertThat(TimeFormatUtils.format(TIMESTAMP, "%F %T")).isEqualTo("2024-05-02 07:08:09");
        assertThat(TimeFormatUtils.format(TIMESTAMP, "100%% %j")).isEqualTo("100% 123");
    }

    @Test
    @DisplayName("Renders offsets in both compact and colon forms")
    void format_rendersOffsets() {
        assertThat(TimeFormatUtils.format(TIMESTAMP, "%Y-%m-%dT%H:%M:%S%:z")).isEqualTo("2024-05-02T07:08:09+00:00");
        assertThat(TimeFormatUtils.format(TIMESTAMP.withZoneSameInstant(ZoneOffset.ofHours(-5)), "%H%M%z"))
                .isEqualTo("0208-0500");
    }

    @Test
    @DisplayName("Parses a format without time fields to midnight")
    void compile_defaultsMissingTimeFields() {
        LocalDateTime parsed = LocalDateTime.parse("20240501", TimeFormatUtils.compile("%Y%m%d"));

        assertThat(parsed).isEqualTo(LocalDateTime.of(2024, 5, 1, 0, 0));
    }

    @Test
    @DisplayName("Parses twelve-hour clock with month names")
    void compile_parsesTextFields() {
        LocalDateTime parsed = LocalDateTime.parse("02 May 2024 07:15 PM", TimeFormatUtils.compile("%d %b %Y %I:%M %p"));

        assertThat(parsed).isEqualTo(LocalDateTime.of(2024, 5, 2, 19, 15));
    }

    @Test
    @DisplayName("Rejects hour 24 instead of rolling it over silently")
    void compile_isStrictAboutHour24() {
        assertThatThrownBy(() -> LocalDateTime.parse("2024-05-01 24:00:00", TimeFormatUtils.compile("%Y-%m-%d %H:%M:%S")))
                .isInstanceOf(DateTimeParseException.class);
    }

    @Test
    @DisplayName("ISO timestamp accepts T or space separators and optional offsets")
    void isoTimestamp_acceptsCommonShapes() {
        assertThat(LocalDateTime.parse("2024-01-01 10:15:30", TimeFormatUtils.ISO_TIMESTAMP))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 10, 15, 30));
        assertThat(LocalDateTime.parse("2024-01-01", TimeFormatUtils.ISO_TIMESTAMP))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(OffsetDateTime.parse("2024-01-01T10:15:30+02:00", TimeFormatUtils.ISO_TIMESTAMP))
                .isEqualTo(OffsetDateTime.of(2024, 1, 1, 10, 15, 30, 0, ZoneOffset.ofHours(2)));
    }

    @Test
    @DisplayName("Unknown directives are configuration errors")
    void compile_rejectsUnknownDirective() {
        assertThatThrownBy(() -> TimeFormatUtils.compile("%Y-%Q"))
                .isInstanceOf(SlicerConfigException.class)
                .hasMessageContaining("%Q");
        assertThatThrownBy(() -> TimeFormatUtils.compile("%Y%"))
                .isInstanceOf(SlicerConfigException.class);
    }

    @Test
    @DisplayName("Blank pattern falls back to ISO parsing")
    void formatterOrIso_blankPattern() {
        assertThat(TimeFormatUtils.formatterOrIso(" ")).isSameAs(TimeFormatUtils.ISO_TIMESTAMP);
        assertThat(TimeFormatUtils.formatterOrIso("%Y")).isSameAs(TimeFormatUtils.compile("%Y"));
    }
}
