package com.phillippitts.windpressure.domain;

import java.util.Objects;

/**
 * Read-only parameters shared by every task of one correction run. Built once per run and
 * safe for concurrent access.
 *
 * @param height                 building height H (m)
 * @param width                  building width W (m)
 * @param geometryIndex          geometry index derived from H and W
 * @param correlationCoefficient spatial-correlation coefficient of the pipeline
 * @param dynamicCoefficient     resolved dynamic coefficient; null on the peak path
 * @param areaParameters         terrain coefficients
 */
public record CorrectionContext(double height,
                                double width,
                                GeometryIndex geometryIndex,
                                double correlationCoefficient,
                                Double dynamicCoefficient,
                                AreaParameters areaParameters) {

    public CorrectionContext {
        if (height <= 0.0 || width <= 0.0) {
            throw new IllegalArgumentException(
                    "Building dimensions must be positive, got H=" + height + ", W=" + width);
        }
        Objects.requireNonNull(geometryIndex, "geometryIndex must not be null");
        Objects.requireNonNull(areaParameters, "areaParameters must not be null");
    }

    /**
     * Height minus width, the Z threshold separating the height-based and width-based branches.
     */
    public double dimension() {
        return height - width;
    }

    /**
     * @throws IllegalStateException when the context was built for the peak path
     */
    public double requireDynamicCoefficient() {
        if (dynamicCoefficient == null) {
            throw new IllegalStateException("Dynamic coefficient is not defined for this context");
        }
        return dynamicCoefficient;
    }
}
