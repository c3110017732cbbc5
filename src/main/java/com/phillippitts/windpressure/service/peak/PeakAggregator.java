package com.phillippitts.windpressure.service.peak;

import com.phillippitts.windpressure.config.properties.CorrectionProperties;
import com.phillippitts.windpressure.domain.AggregatedRow;
import com.phillippitts.windpressure.domain.CorrectionContext;
import com.phillippitts.windpressure.domain.MeasurementMode;
import com.phillippitts.windpressure.domain.MeasurementRow;
import com.phillippitts.windpressure.exception.AggregationMismatchException;
import com.phillippitts.windpressure.exception.RecordIoException;
import com.phillippitts.windpressure.service.codec.Delimiter;
import com.phillippitts.windpressure.service.codec.RecordCodec;
import com.phillippitts.windpressure.service.codec.RecordCodec.LineCursor;
import com.phillippitts.windpressure.service.codec.RecordTable;
import com.phillippitts.windpressure.service.codec.RecordTable.RecordLine;
import com.phillippitts.windpressure.service.formula.FormulaEngine;
import com.phillippitts.windpressure.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Two-stage peak pipeline over min or max pressure files.
 *
 * <p><b>Stage 1</b> ({@link #normalize(Path)}) rewrites each file in place: rows sorted by
 * (X, Y, Z) ascending, exponent dropped from scientific-notation pressures, tab-delimited.
 * Files are independent and may be normalized in parallel.
 *
 * <p><b>Stage 2</b> ({@link #aggregate}) reads all normalized files in lockstep. At every row
 * position the row with the extreme pressure (greatest for {@code max}, least for {@code min})
 * is selected, the first file in request order winning ties, and corrected with
 * {@link FormulaEngine#correctPeak} using the selected row's Z. Output rows keep input position
 * order. Stage 2 must only run once stage 1 has finished for every file.
 *
 * <p>Rows are matched by position, so all files must hold the same number of data rows. What
 * happens otherwise is governed by {@link RowCountPolicy}.
 */
@Component
public class PeakAggregator {

    private static final Logger LOG = LogManager.getLogger(PeakAggregator.class);

    private static final Comparator<SortableLine> BY_COORDINATES = Comparator
            .comparingDouble(SortableLine::x)
            .thenComparingDouble(SortableLine::y)
            .thenComparingDouble(SortableLine::z);

    private final RowCountPolicy rowCountPolicy;

    @Autowired
    public PeakAggregator(CorrectionProperties properties) {
        this(properties.getPeak().rowCountPolicy());
    }

    public PeakAggregator(RowCountPolicy rowCountPolicy) {
        this.rowCountPolicy = Objects.requireNonNull(rowCountPolicy, "rowCountPolicy must not be null");
    }

    public RowCountPolicy getRowCountPolicy() {
        return rowCountPolicy;
    }

    /**
     * Stage 1: sorts and canonicalizes one file, overwriting it. Idempotent.
     *
     * @param file peak input file
     * @return the same path, now normalized
     * @throws com.phillippitts.windpressure.exception.RecordParseException if a coordinate is not numeric
     * @throws RecordIoException if reading or writing fails
     */
    public Path normalize(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        RecordTable table = RecordCodec.read(file);

        List<SortableLine> sortable = new ArrayList<>(table.lines().size());
        for (RecordLine line : table.lines()) {
            if (line.fields().size() < RecordCodec.MEASUREMENT_FIELDS) {
                // reuse the codec's error for short rows
                RecordCodec.parseRow(file, line);
            }
            sortable.add(new SortableLine(
                    line.withField(0, RecordCodec.canonicalizeScientific(line.field(0))),
                    RecordCodec.parseNumber(file, line, 1),
                    RecordCodec.parseNumber(file, line, 2),
                    RecordCodec.parseNumber(file, line, 3)));
        }
        sortable.sort(BY_COORDINATES);

        List<List<String>> rows = new ArrayList<>(sortable.size());
        for (SortableLine s : sortable) {
            rows.add(s.line().fields());
        }
        RecordCodec.write(file, table.header(), rows, Delimiter.TAB);
        LOG.debug("Normalized {} rows of {}", rows.size(), file.getFileName());
        return file;
    }

    /**
     * Stage 2: selects the extreme row at every position across {@code files}, corrects it and
     * writes {@code {mode}.csv} to {@code outputDir}.
     *
     * @param files     normalized files, in request order; the first wins ties
     * @param mode      {@link MeasurementMode#MIN} or {@link MeasurementMode#MAX}
     * @param ctx       run context
     * @param outputDir directory receiving the output file
     * @return path of the written file
     * @throws AggregationMismatchException if row counts differ under {@link RowCountPolicy#STRICT}
     */
    public Path aggregate(List<Path> files, MeasurementMode mode, CorrectionContext ctx, Path outputDir) {
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        List<AggregatedRow> selected = aggregateRows(files, mode, ctx);

        List<List<String>> rows = new ArrayList<>(selected.size());
        for (AggregatedRow r : selected) {
            rows.add(RecordCodec.formatRow(r.row()));
        }
        Path target = outputDir.resolve(outputFileName(mode));
        RecordCodec.write(target, outputHeader(mode), rows, Delimiter.TAB);
        LOG.info("Aggregated {} positions across {} files into {}", rows.size(), files.size(), target);
        return target;
    }

    /**
     * Lockstep selection and correction without writing anything.
     *
     * @return one corrected row per position, in position order
     */
    public List<AggregatedRow> aggregateRows(List<Path> files, MeasurementMode mode, CorrectionContext ctx) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        if (!mode.isPeak()) {
            throw new IllegalArgumentException("Peak aggregation needs min or max mode, got " + mode);
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Peak aggregation needs at least one file");
        }

        List<LineCursor> cursors = new ArrayList<>(files.size());
        try {
            for (Path f : files) {
                cursors.add(RecordCodec.open(f));
            }
            return select(cursors, mode, ctx);
        } finally {
            closeAll(cursors);
        }
    }

    public String outputFileName(MeasurementMode mode) {
        return FileNames.peakOutputName(mode.token());
    }

    static List<String> outputHeader(MeasurementMode mode) {
        return List.of(mode.columnHeader(), "X(m)", "Y(m)", "Z(m)");
    }

    private List<AggregatedRow> select(List<LineCursor> cursors, MeasurementMode mode, CorrectionContext ctx) {
        List<AggregatedRow> result = new ArrayList<>();
        RecordLine[] current = new RecordLine[cursors.size()];
        int position = 0;
        while (true) {
            int exhausted = 0;
            for (int i = 0; i < cursors.size(); i++) {
                current[i] = cursors.get(i).next();
                if (current[i] == null) {
                    exhausted++;
                }
            }
            if (exhausted == cursors.size()) {
                return result;
            }
            if (exhausted > 0) {
                handleMismatch(cursors, current, position);
                return result;
            }

            int winner = -1;
            MeasurementRow best = null;
            for (int i = 0; i < cursors.size(); i++) {
                MeasurementRow row = RecordCodec.parseRow(cursors.get(i).file(), current[i]);
                if (best == null || isBetter(mode, row.pressure(), best.pressure())) {
                    best = row;
                    winner = i;
                }
            }
            double corrected = FormulaEngine.correctPeak(best.pressure(), best.z(), ctx);
            result.add(new AggregatedRow(position, best.withPressure(corrected), cursors.get(winner).file()));
            position++;
        }
    }

    private static boolean isBetter(MeasurementMode mode, double candidate, double best) {
        return mode == MeasurementMode.MAX ? candidate > best : candidate < best;
    }

    private void handleMismatch(List<LineCursor> cursors, RecordLine[] current, int position) {
        Map<Path, Integer> counts = new LinkedHashMap<>();
        Path shortest = null;
        for (int i = 0; i < cursors.size(); i++) {
            LineCursor cursor = cursors.get(i);
            if (current[i] == null) {
                counts.put(cursor.file(), position);
                if (shortest == null) {
                    shortest = cursor.file();
                }
            } else {
                int n = position + 1;
                while (cursor.next() != null) {
                    n++;
                }
                counts.put(cursor.file(), n);
            }
        }
        if (rowCountPolicy == RowCountPolicy.STRICT) {
            throw new AggregationMismatchException(counts);
        }
        LOG.warn("Peak files have unequal row counts {}; truncating to {} rows of {}",
                counts, position, shortest);
    }

    private static void closeAll(List<LineCursor> cursors) {
        for (LineCursor cursor : cursors) {
            try {
                cursor.close();
            } catch (IOException e) {
                LOG.warn("Failed to close {}: {}", cursor.file(), e.getMessage());
            }
        }
    }

    private record SortableLine(RecordLine line, double x, double y, double z) {}
}
