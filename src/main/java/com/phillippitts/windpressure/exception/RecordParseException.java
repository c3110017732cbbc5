package com.phillippitts.windpressure.exception;

import java.nio.file.Path;

/**
 * Thrown when a record file contains a row or field that cannot be parsed.
 * Scoped to one file: the dispatcher records it as that file's failure.
 */
public class RecordParseException extends WindPressureException {

    private final Path file;
    private final int lineNumber;

    public RecordParseException(Path file, int lineNumber, String message) {
        super(message + " (file: " + file + ", line: " + lineNumber + ")");
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public RecordParseException(Path file, int lineNumber, String message, Throwable cause) {
        super(message + " (file: " + file + ", line: " + lineNumber + ")", cause);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return 1-based line number in the file, header included
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
