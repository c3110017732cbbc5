package com.phillippitts.windpressure.domain;

import java.util.OptionalDouble;

/**
 * Wind regions with their normative wind pressure in pascals.
 *
 * <p>{@link #CUSTOM} has no normative value; the caller supplies the pressure explicitly.
 */
public enum WindRegion {
    REGION_1A("1a", 170),
    REGION_1("1", 230),
    REGION_2("2", 300),
    REGION_3("3", 380),
    REGION_4("4", 480),
    REGION_5("5", 600),
    REGION_6("6", 730),
    REGION_7("7", 850),
    CUSTOM("custom", Double.NaN);

    private final String label;
    private final double pressurePa;

    WindRegion(String label, double pressurePa) {
        this.label = label;
        this.pressurePa = pressurePa;
    }

    public String label() {
        return label;
    }

    /**
     * @return normative pressure, or empty for {@link #CUSTOM}
     */
    public OptionalDouble normativePressure() {
        return Double.isNaN(pressurePa) ? OptionalDouble.empty() : OptionalDouble.of(pressurePa);
    }

    /**
     * Looks a region up by its short label ("1a", "1" ... "7", "custom").
     *
     * @throws IllegalArgumentException if no region carries the label
     */
    public static WindRegion fromLabel(String label) {
        for (WindRegion region : values()) {
            if (region.label.equalsIgnoreCase(label)) {
                return region;
            }
        }
        throw new IllegalArgumentException("Unknown wind region: " + label);
    }
}
