package com.csvslicer.command;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.model.IndexColumnSpec;
import com.csvslicer.model.TimezoneSpec;
import com.csvslicer.utils.OptionUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Raw {@code slicer.*} options.
 *
 * @param method bucketing method, {@code date:<group format>}
 */
public record SliceOptions(String source,
                           String output,
                           String pathFormat,
                           String method,
                           String indexColumn,
                           String inFormat,
                           String adjustTz,
                           String dateFormatOut,
                           String dropColumns) {

    static final String DATE_METHOD = "date";

    public Path outputRoot() {
        return Path.of(OptionUtils.require(output, "slicer.output"));
    }

    public String requiredPathFormat() {
        return OptionUtils.require(pathFormat, "slicer.path-format");
    }

    public String groupFormat() {
        String value = OptionUtils.require(method, "slicer.method");
        String[] parts = value.split(":", 2);
        if (!DATE_METHOD.equals(parts[0].strip())) {
            throw new SlicerConfigException("Unsupported slicing method '" + parts[0] + "', only '"
                    + DATE_METHOD + ":<format>' is available");
        }
        if (parts.length < 2 || parts[1].isBlank()) {
            throw new SlicerConfigException("Slicing method '" + value + "' has no group format");
        }
        return parts[1];
    }

    public IndexColumnSpec indexColumnSpec() {
        return IndexColumnSpec.parse(indexColumn);
    }

    public Optional<TimezoneSpec> timezone() {
        return TimezoneSpec.parse(adjustTz);
    }

    public List<String> dropColumnList() {
        return OptionUtils.splitList(dropColumns);
    }
}
