package com.csvslicer.exception;

/**
 * Unknown zone labels, localizing values that already carry a zone, or local times the zone cannot represent.
 */
public class TimezoneException extends CsvSlicerException {

    public static final int EXIT_CODE = 4;

    public TimezoneException(String message) {
        super(message);
    }

    public TimezoneException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
