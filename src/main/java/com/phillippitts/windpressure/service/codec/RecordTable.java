package com.phillippitts.windpressure.service.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Textual content of a record file: a header and the data lines that follow it, fields kept as
 * written so that untouched columns round-trip unchanged.
 *
 * @param header    header fields
 * @param lines     data lines in file order
 * @param delimiter delimiter the file was read with
 */
public record RecordTable(List<String> header, List<RecordLine> lines, Delimiter delimiter) {

    public RecordTable {
        header = List.copyOf(header);
        lines = List.copyOf(lines);
        Objects.requireNonNull(delimiter, "delimiter must not be null");
    }

    /**
     * One data line of a record file.
     *
     * @param lineNumber 1-based line number in the file
     * @param fields     fields of the line
     */
    public record RecordLine(int lineNumber, List<String> fields) {

        public RecordLine {
            fields = List.copyOf(fields);
        }

        public String field(int index) {
            return fields.get(index);
        }

        public RecordLine withField(int index, String value) {
            List<String> copy = new ArrayList<>(fields);
            copy.set(index, value);
            return new RecordLine(lineNumber, copy);
        }
    }
}
