package com.phillippitts.windpressure.domain;

/**
 * Terrain roughness coefficients used by the correction formulas.
 *
 * @param alfa    exponent of the height profile
 * @param k10     height-exposure factor at 10 m
 * @param dzeta10 pulsation coefficient at 10 m
 */
public record AreaParameters(double alfa, double k10, double dzeta10) {

    public AreaParameters {
        if (alfa <= 0.0 || k10 <= 0.0 || dzeta10 <= 0.0) {
            throw new IllegalArgumentException(
                    "Area parameters must be positive, got alfa=" + alfa + ", k10=" + k10 + ", dzeta10=" + dzeta10);
        }
    }
}
