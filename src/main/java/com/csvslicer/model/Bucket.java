package com.csvslicer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * One output file of a slicing run and the input rows routed to it.
 */
public record Bucket(Path path, String groupKey, List<Integer> rowPositions) {

    public Bucket {
        rowPositions = List.copyOf(rowPositions);
    }
}
