package com.csvslicer.model;

import com.csvslicer.exception.BucketWriteException;

import java.nio.file.Path;
import java.util.List;

public record BucketWriteReport(List<Path> written, List<BucketWriteException> failures) {

    public BucketWriteReport {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
