package com.phillippitts.windpressure.config.properties;

import com.phillippitts.windpressure.service.peak.RowCountPolicy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CorrectionPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsApplyWhenNothingIsBound() {
        CorrectionProperties properties = CorrectionProperties.defaults();

        assertThat(properties.getOutputDir()).isEqualTo(Path.of(System.getProperty("user.home"), "Documents"));
        assertThat(properties.getDefaultPulsationCorrelation()).isEqualTo(0.85);
        assertThat(properties.getDefaultPeakCorrelation()).isEqualTo(1.0);
        assertThat(properties.getPeak().rowCountPolicy()).isEqualTo(RowCountPolicy.STRICT);
        assertThat(validator.validate(properties)).isEmpty();
    }

    @Test
    void boundValuesOverrideDefaults() {
        CorrectionProperties properties = new CorrectionProperties(Path.of("/data/out"), 0.5, 2.0,
                new CorrectionProperties.Peak(RowCountPolicy.TRUNCATE));

        assertThat(properties.getOutputDir()).isEqualTo(Path.of("/data/out"));
        assertThat(properties.getDefaultPulsationCorrelation()).isEqualTo(0.5);
        assertThat(properties.getDefaultPeakCorrelation()).isEqualTo(2.0);
        assertThat(properties.getPeak().rowCountPolicy()).isEqualTo(RowCountPolicy.TRUNCATE);
    }

    @Test
    void correlationOutsideRangeIsAViolation() {
        CorrectionProperties properties = new CorrectionProperties(null, -1.0, 101.0, null);

        Set<ConstraintViolation<CorrectionProperties>> violations = validator.validate(properties);

        assertThat(violations)
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("defaultPulsationCorrelation", "defaultPeakCorrelation");
    }

    @Test
    void poolPropertiesRejectNonPositiveSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getCorrection().setCorePoolSize(0);
        properties.getCorrection().setThreadNamePrefix(" ");

        assertThat(validator.validate(properties))
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("correction.corePoolSize", "correction.threadNamePrefix");
    }
}
