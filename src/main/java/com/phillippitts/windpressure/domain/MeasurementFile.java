package com.phillippitts.windpressure.domain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A measurement file on disk together with the mode inferred from its name.
 *
 * @param path          location of the file
 * @param inferredMode  mode inferred from the file name, empty when it names no mode
 */
public record MeasurementFile(Path path, Optional<MeasurementMode> inferredMode) {

    public MeasurementFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(inferredMode, "inferredMode must not be null");
    }

    public static MeasurementFile of(Path path) {
        return new MeasurementFile(path, MeasurementMode.fromFileName(path));
    }

    public String fileName() {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
