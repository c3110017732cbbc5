package com.phillippitts.windpressure.domain;

/**
 * Logarithmic decrement of the structure's oscillations. Each value selects the coefficients of
 * the quartic polynomial {@code xi(e1) = c4*e1^4 + c3*e1^3 + c2*e1^2 + c1*e1 + 1}.
 */
public enum Decrement {
    D03(0.3, -1917.9, 971.95, -187.65, 19.745),
    D015(0.15, -3333.3, 1666.7, -311.67, 31.833);

    private final double value;
    private final double c4;
    private final double c3;
    private final double c2;
    private final double c1;

    Decrement(double value, double c4, double c3, double c2, double c1) {
        this.value = value;
        this.c4 = c4;
        this.c3 = c3;
        this.c2 = c2;
        this.c1 = c1;
    }

    public double value() {
        return value;
    }

    /**
     * Evaluates the unrounded polynomial for the given resonance ratio.
     */
    public double polynomial(double e1) {
        return c4 * Math.pow(e1, 4) + c3 * Math.pow(e1, 3) + c2 * Math.pow(e1, 2) + c1 * e1 + 1;
    }

    /**
     * Maps a numeric decrement onto the closed set of supported values.
     *
     * @throws IllegalArgumentException for any value other than 0.3 or 0.15
     */
    public static Decrement of(double value) {
        for (Decrement d : values()) {
            if (Double.compare(d.value, value) == 0) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unsupported decrement: " + value + " (supported: 0.3, 0.15)");
    }
}
