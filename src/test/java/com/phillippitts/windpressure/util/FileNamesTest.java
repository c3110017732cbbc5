package com.phillippitts.windpressure.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileNamesTest {

    @Test
    void basenameStopsAtFirstUnderscore() {
        assertThat(FileNames.basename(Path.of("/data/P12_mean_0deg.csv"))).isEqualTo("P12");
        assertThat(FileNames.basename(Path.of("_mean.csv"))).isEmpty();
        assertThat(FileNames.basename(Path.of("plain.csv"))).isEqualTo("plain.csv");
    }

    @Test
    void outputNames() {
        assertThat(FileNames.pulsationOutputName(Path.of("A_mean.csv"))).isEqualTo("A_puls.csv");
        assertThat(FileNames.peakOutputName("max")).isEqualTo("max.csv");
    }
}
