package com.phillippitts.windpressure.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable input of one correction run, assembled once by the caller and never mutated.
 *
 * <p>Fields that the caller could not fill in are left null; the request validator rejects
 * them with a specific reason before anything is dispatched.
 *
 * @param files                  measurement files, in caller order
 * @param mode                   statistic held by every file
 * @param height                 building height H (m)
 * @param width                  building width W (m)
 * @param terrain                terrain category
 * @param correlationCoefficient spatial-correlation coefficient; null selects the configured default
 * @param dynamicResponse        resonance input (pulsation only); null means not applicable
 * @param outputDir              output directory; null selects the configured default
 */
public record CorrectionRequest(List<Path> files,
                                MeasurementMode mode,
                                Double height,
                                Double width,
                                TerrainCategory terrain,
                                Double correlationCoefficient,
                                DynamicResponse dynamicResponse,
                                Path outputDir) {

    public CorrectionRequest {
        files = files == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(files));
    }

    public List<MeasurementFile> measurementFiles() {
        List<MeasurementFile> result = new ArrayList<>(files.size());
        for (Path p : files) {
            result.add(MeasurementFile.of(p));
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CorrectionRequest}.
     *
     * <pre>
     * CorrectionRequest request = CorrectionRequest.builder()
     *         .files(List.of(Path.of("a_mean.csv")))
     *         .mode(MeasurementMode.MEAN)
     *         .dimensions(50.0, 20.0)
     *         .terrain(TerrainCategory.B)
     *         .dynamicResponse(DynamicResponse.notApplicable())
     *         .build();
     * </pre>
     */
    public static final class Builder {
        private final List<Path> files = new ArrayList<>();
        private MeasurementMode mode;
        private Double height;
        private Double width;
        private TerrainCategory terrain = TerrainCategory.A;
        private Double correlationCoefficient;
        private DynamicResponse dynamicResponse;
        private Path outputDir;

        private Builder() {
        }

        public Builder files(List<Path> files) {
            this.files.clear();
            this.files.addAll(files);
            return this;
        }

        public Builder file(Path file) {
            this.files.add(file);
            return this;
        }

        public Builder mode(MeasurementMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder dimensions(Double height, Double width) {
            this.height = height;
            this.width = width;
            return this;
        }

        public Builder terrain(TerrainCategory terrain) {
            this.terrain = terrain;
            return this;
        }

        public Builder correlationCoefficient(Double correlationCoefficient) {
            this.correlationCoefficient = correlationCoefficient;
            return this;
        }

        public Builder dynamicResponse(DynamicResponse dynamicResponse) {
            this.dynamicResponse = dynamicResponse;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public CorrectionRequest build() {
            return new CorrectionRequest(files, mode, height, width, terrain,
                    correlationCoefficient, dynamicResponse, outputDir);
        }
    }
}
