package com.csvslicer.command;

import java.io.IOException;

/**
 * One of the utilities selectable by the first command-line argument.
 */
public interface CsvCommand {

    String name();

    /**
     * @return process exit status, 0 on success
     */
    int execute() throws IOException;
}
