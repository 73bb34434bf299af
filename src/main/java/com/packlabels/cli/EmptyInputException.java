package com.packlabels.cli;

import java.nio.file.Path;

/**
 * The order sheet has headers but no data rows, so there is nothing to print.
 */
public final class EmptyInputException extends Exception {
    private final Path source;

    EmptyInputException(Path source) {
        super("The order sheet does not contain any rows to print: " + source.getFileName());
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
