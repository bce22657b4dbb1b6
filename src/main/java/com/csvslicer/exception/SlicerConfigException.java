package com.csvslicer.exception;

/**
 * Invalid options, unknown columns or bucket formats that would misroute rows.
 */
public class SlicerConfigException extends CsvSlicerException {

    public static final int EXIT_CODE = 2;

    public SlicerConfigException(String message) {
        super(message);
    }

    public SlicerConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
