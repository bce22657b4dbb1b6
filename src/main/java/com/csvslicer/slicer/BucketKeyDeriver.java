package com.csvslicer.slicer;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.model.Bucket;
import com.csvslicer.model.BucketPlan;
import com.csvslicer.utils.TimeFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes every row to a bucket by formatting its timestamp twice: once into an output path, once into a group key.
 * Both formats must split the rows the same way, otherwise rows would be written to the wrong file.
 */
@Component
public class BucketKeyDeriver {

    private static final Logger log = LoggerFactory.getLogger(BucketKeyDeriver.class);

    public BucketPlan derive(List<ZonedDateTime> index, String pathFormat, String groupFormat, Path outputRoot) {
        DateTimeFormatter pathFormatter = TimeFormatUtils.compile(pathFormat);
        DateTimeFormatter groupFormatter = TimeFormatUtils.compile(groupFormat);

        Map<String, Path> pathByGroup = new LinkedHashMap<>();
        Map<Path, String> groupByPath = new HashMap<>();
        Map<String, List<Integer>> rowsByGroup = new LinkedHashMap<>();

        for (int row = 0; row < index.size(); row++) {
            ZonedDateTime timestamp = index.get(row);
            Path path;
            String group;
            try {
                path = outputRoot.resolve(pathFormatter.format(timestamp)).normalize();
                group = groupFormatter.format(timestamp);
            } catch (DateTimeException e) {
                throw new SlicerConfigException("Cannot format " + timestamp + " with path format '" + pathFormat
                        + "' or group format '" + groupFormat + "'", e);
            }

            Path knownPath = pathByGroup.putIfAbsent(group, path);
            if (knownPath != null && !knownPath.equals(path)) {
                throw misaligned(pathFormat, groupFormat, row, "group '" + group + "' maps to both " + knownPath + " and " + path);
            }
            String knownGroup = groupByPath.putIfAbsent(path, group);
            if (knownGroup != null && !knownGroup.equals(group)) {
                throw misaligned(pathFormat, groupFormat, row, "path " + path + " maps to both groups '" + knownGroup + "' and '" + group + "'");
            }
            rowsByGroup.computeIfAbsent(group, key -> new ArrayList<>()).add(row);
        }

        List<Bucket> buckets = new ArrayList<>(rowsByGroup.size());
        rowsByGroup.forEach((group, rows) -> buckets.add(new Bucket(pathByGroup.get(group), group, rows)));
        log.debug("Derived {} buckets from {} rows", buckets.size(), index.size());
        return new BucketPlan(buckets);
    }

    private static SlicerConfigException misaligned(String pathFormat, String groupFormat, int row, String detail) {
        return new SlicerConfigException("Path format '" + pathFormat + "' and group format '" + groupFormat
                + "' do not produce matching buckets (data row " + row + "): " + detail);
    }
}
