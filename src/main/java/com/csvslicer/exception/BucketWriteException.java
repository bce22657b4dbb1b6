package com.csvslicer.exception;

import java.nio.file.Path;

/**
 * Failure to load, merge or persist one bucket file. Confined to that bucket.
 */
public class BucketWriteException extends CsvSlicerException {

    public static final int EXIT_CODE = 5;

    private final Path bucketPath;

    public BucketWriteException(Path bucketPath, String message) {
        super("Bucket " + bucketPath + ": " + message);
        this.bucketPath = bucketPath;
    }

    public BucketWriteException(Path bucketPath, String message, Throwable cause) {
        super("Bucket " + bucketPath + ": " + message, cause);
        this.bucketPath = bucketPath;
    }

    public Path bucketPath() {
        return bucketPath;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
