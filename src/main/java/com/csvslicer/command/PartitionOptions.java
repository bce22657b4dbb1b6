package com.csvslicer.command;

import com.csvslicer.utils.OptionUtils;

import java.nio.file.Path;

/**
 * Raw {@code partition.*} options.
 */
public record PartitionOptions(String source, String column, String output) {

    public int columnIndex() {
        return OptionUtils.parseInt(column, "partition.column");
    }

    public Path outputRoot() {
        return Path.of(OptionUtils.require(output, "partition.output"));
    }
}
