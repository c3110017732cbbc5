package com.phillippitts.windpressure.service.pulsation;

import com.phillippitts.windpressure.domain.CorrectionContext;
import com.phillippitts.windpressure.domain.MeasurementRow;
import com.phillippitts.windpressure.service.codec.Delimiter;
import com.phillippitts.windpressure.service.codec.RecordCodec;
import com.phillippitts.windpressure.service.codec.RecordTable;
import com.phillippitts.windpressure.service.codec.RecordTable.RecordLine;
import com.phillippitts.windpressure.service.formula.FormulaEngine;
import com.phillippitts.windpressure.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Corrects one mean-pressure file for pulsation.
 *
 * <p>Every data row is corrected with {@link FormulaEngine#correctPulsation} using the row's own
 * Z. Rows whose first field repeats the header's first token (a header pasted again inside the
 * export) are dropped. Coordinates are written back exactly as they were read. The result goes to
 * {@code {basename}_puls.csv} in the output directory, space-delimited, with the header
 * {@code Puls X(m) Y(m) Z(m)}.
 *
 * <p>Stateless; one instance serves all worker threads.
 */
@Component
public class PulsationProcessor {

    private static final Logger LOG = LogManager.getLogger(PulsationProcessor.class);

    static final List<String> OUTPUT_HEADER = List.of("Puls", "X(m)", "Y(m)", "Z(m)");

    /**
     * Transforms one file.
     *
     * @param file      mean-pressure input file
     * @param ctx       run context carrying the dynamic coefficient
     * @param outputDir directory receiving the output file
     * @return path of the written file
     * @throws com.phillippitts.windpressure.exception.RecordParseException if a row is malformed
     * @throws com.phillippitts.windpressure.exception.RecordIoException    if reading or writing fails
     */
    public Path process(Path file, CorrectionContext ctx, Path outputDir) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");

        RecordTable table = RecordCodec.read(file);
        String headerToken = headerToken(table.header());

        List<List<String>> rows = new ArrayList<>(table.lines().size());
        int skipped = 0;
        for (RecordLine line : table.lines()) {
            if (isHeaderRepeat(line, headerToken)) {
                skipped++;
                continue;
            }
            MeasurementRow row = RecordCodec.parseRow(file, line);
            double corrected = FormulaEngine.correctPulsation(row.pressure(), row.z(), ctx);
            rows.add(List.of(RecordCodec.formatNumber(corrected), line.field(1), line.field(2), line.field(3)));
        }
        if (skipped > 0) {
            LOG.debug("Dropped {} repeated header line(s) from {}", skipped, file.getFileName());
        }

        Path target = outputDir.resolve(outputFileName(file));
        RecordCodec.write(target, OUTPUT_HEADER, rows, Delimiter.WHITESPACE);
        LOG.debug("Wrote {} corrected rows to {}", rows.size(), target);
        return target;
    }

    /**
     * Output name for an input file: {@code "P12_mean_0deg.csv"} yields {@code "P12_puls.csv"}.
     */
    public String outputFileName(Path file) {
        return FileNames.pulsationOutputName(file);
    }

    private static String headerToken(List<String> header) {
        if (header.isEmpty()) {
            return "";
        }
        // first word only: a whitespace header may have been merged into one column title
        String first = header.get(0).strip();
        int space = first.indexOf(' ');
        return space < 0 ? first : first.substring(0, space);
    }

    private static boolean isHeaderRepeat(RecordLine line, String headerToken) {
        return !headerToken.isEmpty() && !line.fields().isEmpty() && line.field(0).startsWith(headerToken);
    }
}
