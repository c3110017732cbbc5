package com.phillippitts.windpressure.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a record file cannot be opened, read or written.
 * Always fatal for the affected file.
 */
public class RecordIoException extends WindPressureException {

    private final Path path;

    public RecordIoException(String action, Path path, IOException cause) {
        super("Failed to " + action + " " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
