package com.csvslicer.command;

import com.csvslicer.model.SortSpec;
import com.csvslicer.utils.OptionUtils;

import java.util.List;

/**
 * Raw {@code merge.*} options.
 */
public record MergeOptions(String sources, String column, String sort, String output) {

    public List<String> sourceList() {
        return OptionUtils.splitList(sources);
    }

    public int columnIndex() {
        return OptionUtils.parseInt(column, "merge.column");
    }

    public SortSpec sortSpec() {
        return SortSpec.parse(sort);
    }
}
