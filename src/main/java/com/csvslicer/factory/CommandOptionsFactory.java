package com.csvslicer.factory;

import com.csvslicer.command.ConvertOptions;
import com.csvslicer.command.IngestOptions;
import com.csvslicer.command.MergeOptions;
import com.csvslicer.command.PartitionOptions;
import com.csvslicer.command.SliceOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

/**
 * Binds the command-line options of every command. Values stay raw here and are validated by the command that
 * runs, so options of unused commands never fail startup.
 */
@Component
public class CommandOptionsFactory {

    @Bean
    public IngestOptions ingestOptions(@Value("${csv.names:0}") String names,
                                       @Value("${csv.data-begins:}") String dataBegins,
                                       @Value("${csv.column-names:}") String columnNames,
                                       @Value("${csv.keep-empty-columns:false}") boolean keepEmptyColumns) {
        return new IngestOptions(names, dataBegins, columnNames, keepEmptyColumns);
    }

    @Bean
    public SliceOptions sliceOptions(@Value("${slicer.source:}") String source,
                                     @Value("${slicer.output:.}") String output,
                                     @Value("${slicer.path-format:}") String pathFormat,
                                     @Value("${slicer.method:date:%Y%m%d}") String method,
                                     @Value("${slicer.index-column:}") String indexColumn,
                                     @Value("${slicer.in-format:}") String inFormat,
                                     @Value("${slicer.adjust-tz:}") String adjustTz,
                                     @Value("${slicer.date-format-out:%Y-%m-%dT%H:%M:%S%:z}") String dateFormatOut,
                                     @Value("${slicer.drop-columns:}") String dropColumns) {
        return new SliceOptions(source, output, pathFormat, method, indexColumn, inFormat, adjustTz, dateFormatOut,
                dropColumns);
    }

    @Bean
    public ConvertOptions convertOptions(@Value("${convert.source:}") String source,
                                         @Value("${convert.output:.}") String output,
                                         @Value("${convert.filename-format:}") String filenameFormat,
                                         @Value("${convert.column:timestamp}") String column,
                                         @Value("${convert.timestamp:true}") String timestamp,
                                         @Value("${convert.in-format:%Y-%m-%dT%H:%M:%S.000Z}") String inFormat,
                                         @Value("${convert.out-format:%Y-%m-%dT%H:%M:%S.000Z}") String outFormat,
                                         @Value("${convert.position:0}") String position,
                                         @Value("${convert.drop-columns:}") String dropColumns,
                                         @Value("${convert.adjust-tz:}") String adjustTz) {
        return new ConvertOptions(source, output, filenameFormat, column, timestamp, inFormat, outFormat, position,
                dropColumns, adjustTz);
    }

    @Bean
    public MergeOptions mergeOptions(@Value("${merge.sources:}") String sources,
                                     @Value("${merge.column:0}") String column,
                                     @Value("${merge.sort:0,ASC}") String sort,
                                     @Value("${merge.output:./merged_%Y-%m-%dT%H%M%S.csv}") String output) {
        return new MergeOptions(sources, column, sort, output);
    }

    @Bean
    public PartitionOptions partitionOptions(@Value("${partition.source:}") String source,
                                             @Value("${partition.column:0}") String column,
                                             @Value("${partition.output:.}") String output) {
        return new PartitionOptions(source, column, output);
    }
}
