package com.csvslicer.exception;

/**
 * Root of the failures the commands report. Each subtype maps to a process exit status.
 */
public abstract class CsvSlicerException extends RuntimeException {

    protected CsvSlicerException(String message) {
        super(message);
    }

    protected CsvSlicerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int exitCode();
}
