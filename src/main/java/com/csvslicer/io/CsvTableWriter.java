package com.csvslicer.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes CSV files through a temporary sibling file that replaces the target only once fully written.
 */
@Component
public class CsvTableWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    private final CsvMapper csvMapper;

    public CsvTableWriter(@Qualifier("csvMapper") CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    /**
     * Writes {@code header} (skipped when null) followed by {@code rows}, creating missing parent directories.
     */
    public void write(Path target, List<String> header, List<? extends List<String>> rows) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writer(CsvSchema.emptySchema()).writeValues(writer)) {
                if (header != null) {
                    sequence.write(header);
                }
                for (List<String> row : rows) {
                    sequence.write(row);
                }
            }
            moveIntoPlace(temp, absolute);
            log.debug("Wrote {} rows to {}", rows.size(), absolute);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
