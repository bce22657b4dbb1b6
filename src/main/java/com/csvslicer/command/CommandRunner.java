package com.csvslicer.command;

import com.csvslicer.exception.CsvSlicerException;
import com.csvslicer.exception.SlicerConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the command named by the first non-option argument and keeps its exit status for the process.
 */
@Component
public class CommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    static final int UNEXPECTED_FAILURE = 1;

    private final Map<String, CsvCommand> commands = new TreeMap<>();
    private int exitCode;

    public CommandRunner(List<CsvCommand> commands) {
        commands.forEach(command -> this.commands.put(command.name(), command));
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = dispatch(args.getNonOptionArgs());
    }

    int dispatch(List<String> arguments) {
        if (arguments.isEmpty()) {
            log.error("No command given, expected one of {}", commands.keySet());
            return SlicerConfigException.EXIT_CODE;
        }
        String name = arguments.get(0);
        CsvCommand command = commands.get(name);
        if (command == null) {
            log.error("Unknown command '{}', expected one of {}", name, commands.keySet());
            return SlicerConfigException.EXIT_CODE;
        }

        try {
            int status = command.execute();
            log.info("Command {} finished with status {}", name, status);
            return status;
        } catch (CsvSlicerException e) {
            log.error("Command {} failed: {}", name, e.getMessage());
            log.debug("Failure detail", e);
            return e.exitCode();
        } catch (Exception e) {
            log.error("Command {} failed unexpectedly", name, e);
            return UNEXPECTED_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
