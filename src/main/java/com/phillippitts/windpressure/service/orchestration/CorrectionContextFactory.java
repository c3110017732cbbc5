package com.phillippitts.windpressure.service.orchestration;

import com.phillippitts.windpressure.config.properties.CorrectionProperties;
import com.phillippitts.windpressure.domain.AreaParameters;
import com.phillippitts.windpressure.domain.CorrectionContext;
import com.phillippitts.windpressure.domain.CorrectionRequest;
import com.phillippitts.windpressure.domain.DynamicResponse;
import com.phillippitts.windpressure.exception.CorrectionValidationException;
import com.phillippitts.windpressure.exception.CorrectionValidationException.Reason;
import com.phillippitts.windpressure.service.formula.FormulaEngine;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Builds the read-only {@link CorrectionContext} of a run from a validated request.
 *
 * <p>Fills in the configured default correlation coefficient when the request has none, and
 * resolves the dynamic coefficient through the chain
 * {@code K_Zek -> e1 -> xi -> resolvedDynamic}.
 */
@Component
public class CorrectionContextFactory {

    private final CorrectionProperties properties;

    public CorrectionContextFactory(CorrectionProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * @throws CorrectionValidationException if the dynamic coefficient does not resolve
     */
    public CorrectionContext forPulsation(CorrectionRequest request) {
        double dynamic = resolveDynamic(request);
        if (dynamic == 0.0) {
            throw new CorrectionValidationException(Reason.UNRESOLVED_DYNAMIC_COEFFICIENT,
                    "natural frequency is taken into account but wind pressure, frequency or decrement is missing");
        }
        double corr = request.correlationCoefficient() != null
                ? request.correlationCoefficient()
                : properties.getDefaultPulsationCorrelation();
        return build(request, corr, dynamic);
    }

    public CorrectionContext forPeak(CorrectionRequest request) {
        double corr = request.correlationCoefficient() != null
                ? request.correlationCoefficient()
                : properties.getDefaultPeakCorrelation();
        return build(request, corr, null);
    }

    /**
     * Dynamic coefficient the pulsation formula would apply for this request. 1 when the natural
     * frequency is not taken into account; 0 when it is but the chain cannot be computed.
     */
    public double resolveDynamic(CorrectionRequest request) {
        DynamicResponse response = request.dynamicResponse() == null
                ? DynamicResponse.notApplicable()
                : request.dynamicResponse();
        if (!response.frequencyKnown()) {
            return FormulaEngine.resolvedDynamic(false, OptionalDouble.empty());
        }
        Double alfa = null;
        Double k10 = null;
        if (request.terrain() != null) {
            AreaParameters area = request.terrain().parameters();
            alfa = area.alfa();
            k10 = area.k10();
        }
        OptionalDouble kZek = FormulaEngine.heightExposure(request.height(), alfa, k10);
        OptionalDouble e1 = FormulaEngine.resonanceRatio(
                boxed(response.windPressure()), boxed(kZek), boxed(response.naturalFrequency()));
        OptionalDouble xi = FormulaEngine.dynamicCoefficient(boxed(e1), response.decrement());
        return FormulaEngine.resolvedDynamic(true, xi);
    }

    /**
     * Output directory of a request: its own, else the configured default.
     */
    public Path outputDir(CorrectionRequest request) {
        return request.outputDir() != null ? request.outputDir() : properties.getOutputDir();
    }

    private static CorrectionContext build(CorrectionRequest request, double corr, Double dynamic) {
        double h = request.height();
        double w = request.width();
        return new CorrectionContext(h, w, FormulaEngine.geometryIndex(h, w), corr, dynamic,
                request.terrain().parameters());
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
