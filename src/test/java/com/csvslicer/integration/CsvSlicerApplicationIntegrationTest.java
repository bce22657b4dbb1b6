package com.csvslicer.integration;

import com.csvslicer.command.CommandRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = "slice")
@Tag("integration")
@ActiveProfiles("test")
class CsvSlicerApplicationIntegrationTest {

    @TempDir
    static Path dir;

    @BeforeAll
    static void writeInput() throws IOException {
        Files.writeString(dir.resolve("trades.csv"), """
                TIMESTAMP,price,volume
                2024-05-01 09:30:00,101.5,200
                2024-05-01 24:00:00,102.0,100
                2024-05-02 16:00:00,103.25,50
                """);
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("slicer.source", () -> dir.resolve("trades.csv").toString());
        registry.add("slicer.output", () -> dir.resolve("buckets").toString());
        registry.add("slicer.path-format", () -> "%Y/%m/trades_%Y%m%d.csv");
        registry.add("slicer.index-column", () -> "TIMESTAMP:timestamp");
        registry.add("slicer.in-format", () -> "%Y-%m-%d %H:%M:%S");
        registry.add("slicer.drop-columns", () -> "volume");
    }

    @Autowired
    CommandRunner commandRunner;

    @Test
    @DisplayName("Slice command runs on startup and exits successfully")
    void sliceRunsOnStartup() {
        assertThat(commandRunner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Bucket files are written per day with the rollover row in the next day")
    void bucketsWrittenPerDay() throws IOException {
        Path buckets = dir.resolve("buckets/2024/05");

        assertThat(Files.readAllLines(buckets.resolve("trades_20240501.csv"))).containsExactly(
                "timestamp,price",
                "2024-05-01T09:30:00+00:00,101.5");
        assertThat(Files.readAllLines(buckets.resolve("trades_20240502.csv"))).containsExactly(
                "timestamp,price",
                "2024-05-02T00:00:00+00:00,102.0",
                "2024-05-02T16:00:00+00:00,103.25");
    }
}
