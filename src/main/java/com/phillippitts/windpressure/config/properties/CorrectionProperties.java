package com.phillippitts.windpressure.config.properties;

import com.phillippitts.windpressure.service.peak.RowCountPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the correction pipelines.
 */
@Validated
@ConfigurationProperties(prefix = "correction")
public class CorrectionProperties {

    public static final double DEFAULT_PULSATION_CORRELATION = 0.85;
    public static final double DEFAULT_PEAK_CORRELATION = 1.0;

    /**
     * Directory receiving output files when a request does not name one.
     */
    @NotNull
    private final Path outputDir;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double defaultPulsationCorrelation;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double defaultPeakCorrelation;

    @Valid
    @NotNull
    private final Peak peak;

    public CorrectionProperties(Path outputDir,
                                Double defaultPulsationCorrelation,
                                Double defaultPeakCorrelation,
                                Peak peak) {
        this.outputDir = outputDir == null
                ? Path.of(System.getProperty("user.home"), "Documents")
                : outputDir;
        this.defaultPulsationCorrelation = defaultPulsationCorrelation == null
                ? DEFAULT_PULSATION_CORRELATION
                : defaultPulsationCorrelation;
        this.defaultPeakCorrelation = defaultPeakCorrelation == null
                ? DEFAULT_PEAK_CORRELATION
                : defaultPeakCorrelation;
        this.peak = peak == null ? new Peak(null) : peak;
    }

    /**
     * Properties with every value at its default.
     */
    public static CorrectionProperties defaults() {
        return new CorrectionProperties(null, null, null, null);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public double getDefaultPulsationCorrelation() {
        return defaultPulsationCorrelation;
    }

    public double getDefaultPeakCorrelation() {
        return defaultPeakCorrelation;
    }

    public Peak getPeak() {
        return peak;
    }

    /**
     * Peak pipeline settings.
     *
     * @param rowCountPolicy behaviour on unequal row counts; {@link RowCountPolicy#STRICT} by default
     */
    public record Peak(RowCountPolicy rowCountPolicy) {
        public Peak {
            rowCountPolicy = rowCountPolicy == null ? RowCountPolicy.STRICT : rowCountPolicy;
        }
    }
}
