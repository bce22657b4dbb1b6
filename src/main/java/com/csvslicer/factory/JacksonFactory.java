package com.csvslicer.factory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

/**
 * Jackson mappers: CSV for table files, JSON for structured option values.
 */
@Component
public class JacksonFactory {

    @Bean("csvMapper")
    public CsvMapper csvMapper() {
        return csvMapperInstance();
    }

    @Bean("jsonObjectMapper")
    public ObjectMapper jsonObjectMapper() {
        return JsonMapper.builder().build();
    }

    /**
     * Raw-record CSV mapper: every record is read as a list of cells, header handling is left to the caller.
     * Values are quoted only when they contain a separator, quote or line break.
     */
    public static CsvMapper csvMapperInstance() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
    }
}
