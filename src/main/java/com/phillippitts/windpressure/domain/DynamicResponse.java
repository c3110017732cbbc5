package com.phillippitts.windpressure.domain;

import java.util.OptionalDouble;

/**
 * Caller input for the dynamic (resonance) coefficient of the pulsation pipeline.
 *
 * <p>When the building's natural frequency is not known, no resonance correction is applied
 * and the coefficient resolves to 1. Otherwise the wind pressure, the natural frequency and the
 * decrement must all be present for the coefficient to resolve; any missing value leaves it
 * unresolved and the request is rejected.
 *
 * @param frequencyKnown     whether the natural frequency is taken into account
 * @param naturalFrequencyHz first natural frequency of the building (Hz), may be null
 * @param decrement          logarithmic decrement, may be null
 * @param windRegion         wind region supplying the normative pressure, may be null
 * @param customPressurePa   explicit wind pressure for {@link WindRegion#CUSTOM}, may be null
 */
public record DynamicResponse(boolean frequencyKnown,
                              Double naturalFrequencyHz,
                              Decrement decrement,
                              WindRegion windRegion,
                              Double customPressurePa) {

    private static final DynamicResponse NOT_APPLICABLE = new DynamicResponse(false, null, null, null, null);

    public static DynamicResponse notApplicable() {
        return NOT_APPLICABLE;
    }

    public static DynamicResponse of(WindRegion windRegion, double naturalFrequencyHz, Decrement decrement) {
        return new DynamicResponse(true, naturalFrequencyHz, decrement, windRegion, null);
    }

    public static DynamicResponse ofCustomPressure(double pressurePa, double naturalFrequencyHz, Decrement decrement) {
        return new DynamicResponse(true, naturalFrequencyHz, decrement, WindRegion.CUSTOM, pressurePa);
    }

    /**
     * Wind pressure feeding the resonance ratio: the region's normative value, or the custom
     * pressure for {@link WindRegion#CUSTOM} (or when no region is given).
     */
    public OptionalDouble windPressure() {
        if (windRegion != null && windRegion != WindRegion.CUSTOM) {
            return windRegion.normativePressure();
        }
        return customPressurePa == null ? OptionalDouble.empty() : OptionalDouble.of(customPressurePa);
    }

    public OptionalDouble naturalFrequency() {
        return naturalFrequencyHz == null ? OptionalDouble.empty() : OptionalDouble.of(naturalFrequencyHz);
    }
}
