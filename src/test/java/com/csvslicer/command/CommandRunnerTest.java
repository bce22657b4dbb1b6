package com.csvslicer.command;

import com.csvslicer.exception.BucketWriteException;
import com.csvslicer.exception.TimezoneException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class CommandRunnerTest {

    private CsvCommand slice;
    private CsvCommand merge;
    private CommandRunner runner;

    @BeforeEach
    void setUp() {
        slice = mock(CsvCommand.class);
        merge = mock(CsvCommand.class);
        when(slice.name()).thenReturn("slice");
        when(merge.name()).thenReturn("merge");
        runner = new CommandRunner(List.of(slice, merge));
    }

    @Test
    @DisplayName("Runs the command named by the first argument and keeps its status")
    void run_dispatchesToNamedCommand() throws IOException {
        when(slice.execute()).thenReturn(0);

        runner.run(new DefaultApplicationArguments("slice", "--slicer.source=data.csv"));

        assertThat(runner.getExitCode()).isZero();
        verify(slice, times(1)).execute();
        verify(merge, never()).execute();
    }

    @Test
    @DisplayName("Missing or unknown commands exit with the configuration status")
    void dispatch_rejectsUnknownCommand() throws IOException {
        assertThat(runner.dispatch(List.of())).isEqualTo(2);
        assertThat(runner.dispatch(List.of("explode"))).isEqualTo(2);
        verify(slice, never()).execute();
    }

    @Test
    @DisplayName("Failures map to the exit status of their type")
    void dispatch_mapsFailuresToStatus() throws IOException {
        when(slice.execute()).thenThrow(new TimezoneException("Unrecognized timezone 'Mars'"));
        when(merge.execute()).thenThrow(new BucketWriteException(Path.of("out.csv"), "disk full"));

        assertThat(runner.dispatch(List.of("slice"))).isEqualTo(4);
        assertThat(runner.dispatch(List.of("merge"))).isEqualTo(5);
    }

    @Test
    @DisplayName("Unexpected failures exit with status 1")
    void dispatch_mapsUnexpectedFailures() throws IOException {
        when(slice.execute()).thenThrow(new IOException("disk gone"));

        assertThat(runner.dispatch(List.of("slice"))).isEqualTo(CommandRunner.UNEXPECTED_FAILURE);
    }

    @Test
    @DisplayName("Non-zero command results are passed through")
    void dispatch_passesThroughStatus() throws IOException {
        when(slice.execute()).thenReturn(5);

        assertThat(runner.dispatch(List.of("slice", "extra"))).isEqualTo(5);
    }
}
