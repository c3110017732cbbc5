package com.phillippitts.windpressure.service.codec;

import com.phillippitts.windpressure.domain.MeasurementRow;
import com.phillippitts.windpressure.exception.RecordIoException;
import com.phillippitts.windpressure.exception.RecordParseException;
import com.phillippitts.windpressure.service.codec.RecordTable.RecordLine;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes the flat record layouts of the correction pipelines.
 *
 * <p>A record file is a header line followed by data lines of at least four fields:
 * {@code pressure X Y Z}. Fields are separated by tabs, commas or runs of spaces; the delimiter
 * is inferred per file. Blank lines are ignored.
 *
 * <p>Writes are atomic: content goes to a temporary file in the target directory which then
 * replaces the target, so a failed or interrupted write never leaves a partial output behind.
 */
public final class RecordCodec {

    /** Number of leading numeric fields of a measurement line: pressure, X, Y, Z. */
    public static final int MEASUREMENT_FIELDS = 4;

    private static final String LINE_SEPARATOR = "\n";

    private RecordCodec() {}

    /**
     * Reads a whole record file.
     *
     * <p>When the file is whitespace-delimited and its header splits into more fields than the
     * first data line (a pressure column title containing spaces, such as
     * {@code Max of Pressure (Pa)}), the surplus leading header tokens are joined back into the
     * first column title.
     *
     * @param file file to read
     * @return header and data lines
     * @throws RecordIoException    if the file cannot be read
     * @throws RecordParseException if the file has no header line
     */
    public static RecordTable read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        List<String> raw;
        try {
            raw = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordIoException("read", file, e);
        }

        int headerIndex = firstNonBlank(raw, 0);
        if (headerIndex < 0) {
            throw new RecordParseException(file, 1, "Record file is empty");
        }
        String headerLine = stripBom(raw.get(headerIndex));
        int firstDataIndex = firstNonBlank(raw, headerIndex + 1);
        Delimiter delimiter = inferDelimiter(firstDataIndex < 0 ? headerLine : raw.get(firstDataIndex));

        List<RecordLine> lines = new ArrayList<>();
        for (int i = headerIndex + 1; i < raw.size(); i++) {
            String line = raw.get(i);
            if (!line.isBlank()) {
                lines.add(new RecordLine(i + 1, delimiter.split(line)));
            }
        }

        List<String> header = delimiter.split(headerLine);
        if (delimiter == Delimiter.WHITESPACE && !lines.isEmpty()) {
            header = mergeHeader(header, lines.get(0).fields().size());
        }
        return new RecordTable(header, lines, delimiter);
    }

    /**
     * Delimiter of a record file, judged from one of its lines.
     *
     * @see Delimiter#infer(String)
     */
    public static Delimiter inferDelimiter(String sampleLine) {
        return Delimiter.infer(Objects.requireNonNull(sampleLine, "sampleLine must not be null"));
    }

    /**
     * Parses every data line of a table into measurement rows.
     *
     * @throws RecordParseException on the first malformed line
     */
    public static List<MeasurementRow> parseRows(Path file, RecordTable table) {
        List<MeasurementRow> rows = new ArrayList<>(table.lines().size());
        for (RecordLine line : table.lines()) {
            rows.add(parseRow(file, line));
        }
        return rows;
    }

    /**
     * Parses the leading {@code pressure X Y Z} fields of one line.
     *
     * @throws RecordParseException if the line has fewer than four fields or a field is not numeric
     */
    public static MeasurementRow parseRow(Path file, RecordLine line) {
        List<String> fields = line.fields();
        if (fields.size() < MEASUREMENT_FIELDS) {
            throw new RecordParseException(file, line.lineNumber(),
                    "Expected " + MEASUREMENT_FIELDS + " fields but found " + fields.size());
        }
        return new MeasurementRow(
                parseNumber(file, line, 0),
                parseNumber(file, line, 1),
                parseNumber(file, line, 2),
                parseNumber(file, line, 3));
    }

    /**
     * Parses one field of a line as a decimal number.
     *
     * @throws RecordParseException if the field is not numeric
     */
    public static double parseNumber(Path file, RecordLine line, int index) {
        String field = line.field(index);
        try {
            return Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new RecordParseException(file, line.lineNumber(),
                    "Field " + (index + 1) + " is not numeric: '" + field + "'", e);
        }
    }

    /**
     * Drops the exponent of a pressure field written in scientific notation by truncating at the
     * exponent marker: {@code "1.23e-05"} becomes {@code "1.23"}. Fields without an exponent are
     * returned unchanged.
     */
    public static String canonicalizeScientific(String field) {
        Objects.requireNonNull(field, "field must not be null");
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == 'e' || c == 'E') {
                return field.substring(0, i);
            }
        }
        return field;
    }

    /**
     * Formats a computed number for output: the digits of {@link Double#toString(double)} in plain
     * decimal notation, never with an exponent, and with a trailing {@code .0} for whole numbers
     * ({@code 5.0E-4} is written as {@code 0.0005}, {@code 1.2345678E7} as {@code 12345678.0}).
     * Zero, NaN and infinities keep their {@code Double.toString} form.
     */
    public static String formatNumber(double value) {
        if (value == 0.0 || !Double.isFinite(value)) {
            return Double.toString(value);
        }
        String plain = new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /**
     * Formats a measurement row as four output fields.
     */
    public static List<String> formatRow(MeasurementRow row) {
        return List.of(formatNumber(row.pressure()), formatNumber(row.x()),
                formatNumber(row.y()), formatNumber(row.z()));
    }

    /**
     * Writes a header and rows to {@code target}, replacing any existing file atomically.
     *
     * @param target    output path
     * @param header    header fields
     * @param rows      data rows
     * @param delimiter field separator
     * @throws RecordIoException if the file cannot be written
     */
    public static void write(Path target, List<String> header, List<List<String>> rows, Delimiter delimiter) {
        Objects.requireNonNull(target, "target must not be null");
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(String.join(delimiter.separator(), header));
                w.write(LINE_SEPARATOR);
                for (List<String> row : rows) {
                    w.write(String.join(delimiter.separator(), row));
                    w.write(LINE_SEPARATOR);
                }
            }
            moveIntoPlace(tmp, target);
            tmp = null;
        } catch (IOException e) {
            throw new RecordIoException("write", target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Opens a record file for sequential reading. The header line is consumed and exposed via
     * {@link LineCursor#header()}.
     *
     * @throws RecordIoException    if the file cannot be opened
     * @throws RecordParseException if the file has no header line
     */
    public static LineCursor open(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try {
            return new LineCursor(file, Files.newBufferedReader(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RecordIoException("open", file, e);
        }
    }

    /**
     * Forward-only reader over the data lines of one record file. Data lines are split on runs of
     * whitespace, which covers the tab- and space-delimited layouts.
     */
    public static final class LineCursor implements Closeable {
        private final Path file;
        private final BufferedReader reader;
        private final List<String> header;
        private int lineNumber;

        private LineCursor(Path file, BufferedReader reader) throws IOException {
            this.file = file;
            this.reader = reader;
            try {
                String first = nextNonBlank();
                if (first == null) {
                    throw new RecordParseException(file, 1, "Record file is empty");
                }
                this.header = Delimiter.infer(first).split(stripBom(first));
            } catch (IOException | RuntimeException e) {
                reader.close();
                throw e;
            }
        }

        public Path file() {
            return file;
        }

        public List<String> header() {
            return header;
        }

        /**
         * @return the next data line, or null at end of file
         * @throws RecordIoException if reading fails
         */
        public RecordLine next() {
            try {
                String line = nextNonBlank();
                return line == null ? null : new RecordLine(lineNumber, Delimiter.WHITESPACE.split(line));
            } catch (IOException e) {
                throw new RecordIoException("read", file, e);
            }
        }

        private String nextNonBlank() throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!line.isBlank()) {
                    return line;
                }
            }
            return null;
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            tmp.toFile().deleteOnExit();
        }
    }

    private static List<String> mergeHeader(List<String> header, int width) {
        if (width < 1 || header.size() <= width) {
            return header;
        }
        int surplus = header.size() - width;
        List<String> merged = new ArrayList<>(width);
        merged.add(String.join(" ", header.subList(0, surplus + 1)));
        merged.addAll(header.subList(surplus + 1, header.size()));
        return merged;
    }

    private static int firstNonBlank(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
