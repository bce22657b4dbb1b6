package com.csvslicer.command;

import com.csvslicer.model.TimezoneSpec;
import com.csvslicer.utils.OptionUtils;

import java.util.List;
import java.util.Optional;

/**
 * Raw {@code convert.*} options.
 */
public record ConvertOptions(String source,
                             String output,
                             String filenameFormat,
                             String column,
                             String timestamp,
                             String inFormat,
                             String outFormat,
                             String position,
                             String dropColumns,
                             String adjustTz) {

    public int positionIndex() {
        return OptionUtils.parseInt(position, "convert.position");
    }

    public Optional<TimezoneSpec> timezone() {
        return TimezoneSpec.parse(adjustTz);
    }

    public List<String> dropColumnList() {
        return OptionUtils.splitList(dropColumns);
    }
}
