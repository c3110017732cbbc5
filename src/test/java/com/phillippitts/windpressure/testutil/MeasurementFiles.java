package com.phillippitts.windpressure.testutil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small tab-delimited measurement files for tests.
 */
public final class MeasurementFiles {

    private MeasurementFiles() {
    }

    /**
     * Writes {@code header} followed by one line per row, each row given as
     * {@code {pressure, x, y, z}}.
     */
    public static Path write(Path dir, String name, String header, double[]... rows) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (double[] r : rows) {
            sb.append(r[0]).append('\t').append(r[1]).append('\t').append(r[2]).append('\t').append(r[3]).append('\n');
        }
        try {
            return Files.writeString(dir.resolve(name), sb.toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
