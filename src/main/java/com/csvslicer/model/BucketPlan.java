package com.csvslicer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Buckets in order of first appearance in the input. {@code paths().get(i)} and {@code groupKeys().get(i)}
 * always describe the same bucket.
 */
public record BucketPlan(List<Bucket> buckets) {

    public BucketPlan {
        buckets = List.copyOf(buckets);
    }

    public List<Path> paths() {
        return buckets.stream().map(Bucket::path).toList();
    }

    public List<String> groupKeys() {
        return buckets.stream().map(Bucket::groupKey).toList();
    }
}
