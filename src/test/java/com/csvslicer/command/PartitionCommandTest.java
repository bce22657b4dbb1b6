package com.csvslicer.command;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.factory.JacksonFactory;
import com.csvslicer.io.CsvTableReader;
import com.csvslicer.io.CsvTableWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionCommandTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Writes one file per distinct value with records in input order")
    void execute_writesFilePerValue() throws IOException {
        Path source = write("""
                TRADE,1,x
                QUOTE,2,"a,b"
                TRADE,3,z
                """);
        Path output = dir.resolve("parts");

        int status = command(new PartitionOptions(source.toString(), "0", output.toString())).execute();

        assertThat(status).isZero();
        assertThat(Files.readAllLines(output.resolve("TRADE.csv"))).containsExactly("TRADE,1,x", "TRADE,3,z");
        assertThat(Files.readAllLines(output.resolve("QUOTE.csv"))).containsExactly("QUOTE,2,\"a,b\"");
        try (Stream<Path> files = Files.list(output)) {
            assertThat(files).hasSize(2);
        }
    }

    @Test
    @DisplayName("Partitions on a column other than the first")
    void execute_partitionsOnColumn() throws IOException {
        Path source = write("1,A\n2,B\n3,A\n");
        Path output = dir.resolve("parts");

        command(new PartitionOptions(source.toString(), "1", output.toString())).execute();

        assertThat(Files.readAllLines(output.resolve("A.csv"))).containsExactly("1,A", "3,A");
        assertThat(Files.readAllLines(output.resolve("B.csv"))).containsExactly("2,B");
    }

    @Test
    @DisplayName("Records without a value in the partition column are rejected")
    void execute_rejectsMissingValue() throws IOException {
        Path source = write("1,A\n2\n");

        assertThatThrownBy(() -> command(new PartitionOptions(source.toString(), "1", dir.resolve("parts").toString())).execute())
                .isInstanceOf(SlicerConfigException.class)
                .hasMessageContaining("Record 1");
    }

    private PartitionCommand command(PartitionOptions options) {
        return new PartitionCommand(options,
                new CsvTableReader(JacksonFactory.csvMapperInstance()),
                new CsvTableWriter(JacksonFactory.csvMapperInstance()));
    }

    private Path write(String content) throws IOException {
        Path file = dir.resolve("mixed.csv");
        Files.writeString(file, content);
        return file;
    }
}
