package com.csvslicer.utils;

import com.csvslicer.exception.SlicerConfigException;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles strftime-style format strings (e.g. "data_%Y-%m-%d.csv") into strict {@link DateTimeFormatter}s.
 * <p>
 * Supported directives: %Y %y %m %d %j %H %I %p %M %S %f %z %:z %Z %a %A %b %B %F %T %%.
 * Any other character is copied literally. Fields missing from a pattern default to the start of their
 * period when parsing, so "%Y%m%d" parses to midnight.
 */
public final class TimeFormatUtils {

    /**
     * ISO-8601 date with optional time (separated by 'T' or a space) and optional offset.
     */
    public static final DateTimeFormatter ISO_TIMESTAMP = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendPattern("[' ']['T']")
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    public static final String ISO_TIMESTAMP_LABEL = "ISO-8601";

    private static final Map<String, DateTimeFormatter> CACHE = new ConcurrentHashMap<>();

    private TimeFormatUtils() {
    }

    /**
     * Returns the formatter for a strftime pattern, or {@link #ISO_TIMESTAMP} when the pattern is blank.
     */
    public static DateTimeFormatter formatterOrIso(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return ISO_TIMESTAMP;
        }
        return compile(pattern);
    }

    public static DateTimeFormatter compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new SlicerConfigException("Time format must not be empty");
        }
        return CACHE.computeIfAbsent(pattern, TimeFormatUtils::build);
    }

    public static String format(TemporalAccessor temporal, String pattern) {
        return compile(pattern).format(temporal);
    }

    private static DateTimeFormatter build(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        Set<Character> directives = new HashSet<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i++);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i >= pattern.length()) {
                throw new SlicerConfigException("Dangling '%' at end of time format '" + pattern + "'");
            }
            char directive = pattern.charAt(i++);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            flushLiteral(builder, literal);
            if (directive == ':') {
                if (i >= pattern.length() || pattern.charAt(i) != 'z') {
                    throw new SlicerConfigException("Unsupported directive '%:' in time format '" + pattern + "'");
                }
                i++;
                builder.appendOffset("+HH:MM", "+00:00");
                directives.add('z');
                continue;
            }
            appendDirective(builder, directive, pattern);
            directives.add(directive);
        }
        flushLiteral(builder, literal);
        applyParseDefaults(builder, directives);
        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    private static void appendDirective(DateTimeFormatterBuilder builder, char directive, String pattern) {
        switch (directive) {
            case 'Y' -> builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD);
            case 'y' -> builder.appendValueReduced(ChronoField.YEAR, 2, 2, 2000);
            case 'm' -> builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
            case 'd' -> builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
            case 'j' -> builder.appendValue(ChronoField.DAY_OF_YEAR, 3);
            case 'H' -> builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
            case 'I' -> builder.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 2);
            case 'p' -> builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
            case 'M' -> builder.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
            case 'S' -> builder.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
            case 'f' -> builder.appendFraction(ChronoField.NANO_OF_SECOND, 6, 6, false);
            case 'z' -> builder.appendOffset("+HHMM", "+0000");
            case 'Z' -> builder.appendZoneId();
            case 'a' -> builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
            case 'A' -> builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
            case 'b' -> builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
            case 'B' -> builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
            case 'F' -> builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
                    .appendLiteral('-')
                    .appendValue(ChronoField.MONTH_OF_YEAR, 2)
                    .appendLiteral('-')
                    .appendValue(ChronoField.DAY_OF_MONTH, 2);
            case 'T' -> builder.appendValue(ChronoField.HOUR_OF_DAY, 2)
                    .appendLiteral(':')
                    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                    .appendLiteral(':')
                    .appendValue(ChronoField.SECOND_OF_MINUTE, 2);
            default -> throw new SlicerConfigException(
                    "Unsupported directive '%" + directive + "' in time format '" + pattern + "'");
        }
    }

    private static void applyParseDefaults(DateTimeFormatterBuilder builder, Set<Character> directives) {
        boolean hasDate = directives.contains('F');
        boolean hasTime = directives.contains('T');
        if (!hasDate && !directives.contains('Y') && !directives.contains('y')) {
            builder.parseDefaulting(ChronoField.YEAR, 1900);
        }
        if (!hasDate && !directives.contains('j')) {
            if (!directives.contains('m') && !directives.contains('b') && !directives.contains('B')) {
                builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
            }
            if (!directives.contains('d')) {
                builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
            }
        }
        if (!hasTime) {
            if (!directives.contains('H') && !directives.contains('I')) {
                builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
            }
            if (!directives.contains('M')) {
                builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
            }
            if (!directives.contains('S')) {
                builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
            }
        }
    }

    private static void flushLiteral(DateTimeFormatterBuilder builder, StringBuilder literal) {
        if (literal.length() > 0) {
            builder.appendLiteral(literal.toString());
            literal.setLength(0);
        }
    }
}
