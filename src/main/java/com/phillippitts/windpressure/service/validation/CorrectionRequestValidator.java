package com.phillippitts.windpressure.service.validation;

import com.phillippitts.windpressure.domain.CorrectionRequest;
import com.phillippitts.windpressure.domain.MeasurementFile;
import com.phillippitts.windpressure.domain.MeasurementMode;
import com.phillippitts.windpressure.domain.Pipeline;
import com.phillippitts.windpressure.exception.CorrectionValidationException;
import com.phillippitts.windpressure.exception.CorrectionValidationException.Reason;
import com.phillippitts.windpressure.service.orchestration.CorrectionContextFactory;
import com.phillippitts.windpressure.util.FileNames;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a {@link CorrectionRequest} before any task is dispatched.
 *
 * <p>Validation rules, checked in this order:
 * <ul>
 *   <li>At least one file</li>
 *   <li>Every file name names a mode, and mean files are not mixed with min/max files</li>
 *   <li>The request carries a mode the pipeline accepts and every file name contains it</li>
 *   <li>Height and width are present, finite and positive</li>
 *   <li>A terrain category is selected</li>
 *   <li>A given correlation coefficient lies in [0, 100]</li>
 *   <li>Pulsation only: output names do not collide, and the dynamic coefficient resolves</li>
 *   <li>Peak only: no file is listed twice</li>
 * </ul>
 *
 * <p>Throws {@link CorrectionValidationException} with a {@link Reason} code on the first
 * violated rule.
 */
@Component
public class CorrectionRequestValidator {

    static final double MAX_CORRELATION = 100.0;

    private final CorrectionContextFactory contextFactory;

    public CorrectionRequestValidator(CorrectionContextFactory contextFactory) {
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory must not be null");
    }

    /**
     * @throws CorrectionValidationException if the request cannot run through the pulsation pipeline
     */
    public void validatePulsation(CorrectionRequest request) {
        validateCommon(request, Pipeline.PULSATION);
        requireDistinctOutputNames(request.files());
        if (contextFactory.resolveDynamic(request) == 0.0) {
            throw new CorrectionValidationException(Reason.UNRESOLVED_DYNAMIC_COEFFICIENT,
                    "natural frequency is taken into account but wind pressure, frequency or decrement is missing");
        }
    }

    /**
     * @throws CorrectionValidationException if the request cannot run through the peak pipeline
     */
    public void validatePeak(CorrectionRequest request) {
        validateCommon(request, Pipeline.PEAK);
        requireDistinctFiles(request.files());
    }

    private void validateCommon(CorrectionRequest request, Pipeline pipeline) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.files().isEmpty()) {
            throw new CorrectionValidationException(Reason.NO_FILES, "no files selected");
        }
        List<MeasurementFile> files = request.measurementFiles();
        requireSingleFileFamily(files);

        MeasurementMode mode = request.mode();
        if (mode == null) {
            throw new CorrectionValidationException(Reason.MISSING_MODE, "request carries no mode");
        }
        if (!pipeline.accepts(mode)) {
            throw new CorrectionValidationException(Reason.PIPELINE_MODE_MISMATCH,
                    mode.token() + " files cannot run through the " + pipeline.tag() + " pipeline");
        }
        for (MeasurementFile f : files) {
            boolean sameFamily = f.inferredMode().map(MeasurementMode::isPeak).orElse(false) == mode.isPeak();
            if (!sameFamily || !mode.appearsIn(f.path())) {
                throw new CorrectionValidationException(Reason.PIPELINE_MODE_MISMATCH,
                        "request mode " + mode + " but file name '" + f.fileName() + "' does not name it");
            }
        }

        if (!isPositive(request.height()) || !isPositive(request.width())) {
            throw new CorrectionValidationException(Reason.MISSING_DIMENSIONS,
                    "building height and width must be positive, got H=" + request.height()
                            + ", W=" + request.width());
        }
        if (request.terrain() == null) {
            throw new CorrectionValidationException(Reason.MISSING_TERRAIN, "no terrain category selected");
        }
        Double corr = request.correlationCoefficient();
        if (corr != null && (corr.isNaN() || corr < 0.0 || corr > MAX_CORRELATION)) {
            throw new CorrectionValidationException(Reason.INVALID_CORRELATION_COEFFICIENT,
                    "correlation coefficient must be within [0, 100], got " + corr);
        }
    }

    private static void requireSingleFileFamily(List<MeasurementFile> files) {
        MeasurementMode first = null;
        for (MeasurementFile f : files) {
            MeasurementMode m = f.inferredMode().orElseThrow(() -> new CorrectionValidationException(
                    Reason.UNKNOWN_FILE_MODE,
                    "cannot tell mean, min or max from file name '" + f.fileName() + "'"));
            if (first == null) {
                first = m;
            } else if (first.isPeak() != m.isPeak()) {
                throw new CorrectionValidationException(Reason.MIXED_FILE_MODES,
                        "files mix " + first.token() + " and " + m.token() + " data ('" + f.fileName() + "')");
            }
        }
    }

    private static void requireDistinctFiles(List<Path> files) {
        Set<Path> seen = new HashSet<>();
        for (Path file : files) {
            if (!seen.add(file.toAbsolutePath().normalize())) {
                throw new CorrectionValidationException(Reason.DUPLICATE_INPUT_FILE,
                        file + " is listed more than once");
            }
        }
    }

    private static void requireDistinctOutputNames(List<Path> files) {
        Map<String, Path> seen = new HashMap<>();
        for (Path file : files) {
            String name = FileNames.pulsationOutputName(file);
            Path other = seen.putIfAbsent(name, file);
            if (other != null) {
                throw new CorrectionValidationException(Reason.DUPLICATE_OUTPUT_NAME,
                        other.getFileName() + " and " + file.getFileName() + " would both write " + name);
            }
        }
    }

    private static boolean isPositive(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }
}
