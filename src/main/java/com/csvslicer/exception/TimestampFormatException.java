package com.csvslicer.exception;

/**
 * A timestamp string that does not match its format and is not a recognised 24:00 rollover.
 */
public class TimestampFormatException extends CsvSlicerException {

    public static final int EXIT_CODE = 3;
    public static final int UNKNOWN_ROW = -1;

    private final String rawValue;
    private final String format;
    private final int rowNumber;

    public TimestampFormatException(String rawValue, String format, Throwable cause) {
        this(rawValue, format, UNKNOWN_ROW, cause);
    }

    public TimestampFormatException(String rawValue, String format, int rowNumber, Throwable cause) {
        super(describe(rawValue, format, rowNumber), cause);
        this.rawValue = rawValue;
        this.format = format;
        this.rowNumber = rowNumber;
    }

    public TimestampFormatException atRow(int row) {
        return new TimestampFormatException(rawValue, format, row, getCause());
    }

    public String rawValue() {
        return rawValue;
    }

    public String format() {
        return format;
    }

    public int rowNumber() {
        return rowNumber;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }

    private static String describe(String rawValue, String format, int rowNumber) {
        String message = "Unparsable timestamp '" + rawValue + "' for format '" + format + "'";
        return rowNumber == UNKNOWN_ROW ? message : message + " at data row " + rowNumber;
    }
}
