package com.phillippitts.windpressure.domain;

/**
 * Terrain roughness classification. Each category supplies a fixed {@link AreaParameters} triple.
 */
public enum TerrainCategory {
    A(new AreaParameters(0.15, 1.00, 0.76)),
    B(new AreaParameters(0.20, 0.65, 1.06)),
    C(new AreaParameters(0.25, 0.40, 1.78));

    private final AreaParameters parameters;

    TerrainCategory(AreaParameters parameters) {
        this.parameters = parameters;
    }

    public AreaParameters parameters() {
        return parameters;
    }
}
