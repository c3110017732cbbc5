package com.phillippitts.windpressure.service.formula;

import com.phillippitts.windpressure.domain.AreaParameters;
import com.phillippitts.windpressure.domain.CorrectionContext;
import com.phillippitts.windpressure.domain.Decrement;
import com.phillippitts.windpressure.domain.GeometryIndex;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Wind-pressure correction formulas.
 *
 * <p>Pure and stateless: no I/O, no shared state, safe to call from any thread. Intermediate
 * quantities of the dynamic-coefficient chain ({@code K_Zek}, {@code e1}, {@code xi}) are
 * rounded to three decimals; an {@link OptionalDouble#empty() empty} result means the value is
 * undefined because an input was absent.
 *
 * <p>The pulsation and peak corrections differ in shape and must stay that way:
 * <pre>
 * pulsation: p * (dzeta10 * (h/10)^-alfa) * dynamic * corr + p
 * peak:      p * (1 + dzeta10 * (h/10)^-alfa) * corr
 * </pre>
 * where the reference height {@code h} is chosen from H, W or the row's Z by
 * {@link #referenceHeight(double, CorrectionContext)}.
 */
public final class FormulaEngine {

    private static final int SCALE = 3;

    private FormulaEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Classifies the building's wind-exposure regime.
     *
     * @param height building height H
     * @param width  building width W
     * @return {@code ONE} when {@code H <= W}, {@code THREE} when {@code H > 2W}, else {@code TWO}
     */
    public static GeometryIndex geometryIndex(double height, double width) {
        if (height <= width) {
            return GeometryIndex.ONE;
        }
        if (height > 2 * width) {
            return GeometryIndex.THREE;
        }
        return GeometryIndex.TWO;
    }

    /**
     * Height-exposure factor {@code K_Zek = k10 * (0.8 * H / 10)^(2 * alfa)}, rounded to 3 decimals.
     *
     * @return the factor, or empty if any input is absent
     */
    public static OptionalDouble heightExposure(Double height, Double alfa, Double k10) {
        if (height == null || alfa == null || k10 == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(round3(k10 * Math.pow(height * 0.8 / 10, 2 * alfa)));
    }

    /**
     * Resonance ratio {@code e1 = sqrt(pressure * K_Zek * 1.4) / 940 / frequency}, rounded to 3 decimals.
     *
     * @param pressure  normative wind pressure (Pa)
     * @param kZek      height-exposure factor
     * @param frequency first natural frequency (Hz)
     * @return the ratio, or empty if any input is absent, the frequency is not positive or the
     *         radicand is negative
     */
    public static OptionalDouble resonanceRatio(Double pressure, Double kZek, Double frequency) {
        if (pressure == null || kZek == null || frequency == null || frequency <= 0.0) {
            return OptionalDouble.empty();
        }
        double radicand = pressure * kZek * 1.4;
        if (radicand < 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(round3(Math.sqrt(radicand) / 940 / frequency));
    }

    /**
     * Dynamic coefficient {@code xi}: the decrement's quartic polynomial in {@code e1}, rounded
     * to 3 decimals.
     *
     * @return the coefficient, or empty if {@code e1} or the decrement is absent
     */
    public static OptionalDouble dynamicCoefficient(Double e1, Decrement decrement) {
        if (e1 == null || decrement == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(round3(decrement.polynomial(e1)));
    }

    /**
     * Dynamic coefficient actually applied by the pulsation formula.
     *
     * @param frequencyKnown whether the natural frequency is taken into account
     * @param xi             computed dynamic coefficient, possibly empty
     * @return 1 when the frequency is not known; {@code xi} when present; 0 when the frequency is
     *         known but {@code xi} is absent. Callers must reject 0 as an unresolved configuration.
     */
    public static double resolvedDynamic(boolean frequencyKnown, OptionalDouble xi) {
        if (!frequencyKnown) {
            return 1.0;
        }
        return xi.orElse(0.0);
    }

    /**
     * Corrects a mean pressure value for pulsation.
     *
     * @param pressure raw pressure of the row
     * @param z        the row's own Z coordinate
     * @param ctx      run context; must carry a dynamic coefficient
     * @return corrected pressure
     */
    public static double correctPulsation(double pressure, double z, CorrectionContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        double dynamic = ctx.requireDynamicCoefficient();
        double term = profileTerm(referenceHeight(z, ctx), ctx.areaParameters());
        return pressure * term * dynamic * ctx.correlationCoefficient() + pressure;
    }

    /**
     * Corrects an extreme (min/max) pressure value selected by peak aggregation.
     *
     * @param pressure selected pressure
     * @param z        Z coordinate of the selected row
     * @param ctx      run context
     * @return corrected pressure
     */
    public static double correctPeak(double pressure, double z, CorrectionContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        double term = profileTerm(referenceHeight(z, ctx), ctx.areaParameters());
        return pressure * (1 + term) * ctx.correlationCoefficient();
    }

    /**
     * Height that enters the profile term for a row at height {@code z}.
     *
     * <ul>
     *   <li>index 1: always H</li>
     *   <li>index 2: H when {@code z >= H - W}, else W</li>
     *   <li>index 3: H when {@code z >= H - W}, else W when {@code z <= W}, else z itself</li>
     * </ul>
     */
    static double referenceHeight(double z, CorrectionContext ctx) {
        double dimension = ctx.dimension();
        return switch (ctx.geometryIndex()) {
            case ONE -> ctx.height();
            case TWO -> z >= dimension ? ctx.height() : ctx.width();
            case THREE -> {
                if (z >= dimension) {
                    yield ctx.height();
                }
                yield z <= ctx.width() ? ctx.width() : z;
            }
        };
    }

    private static double profileTerm(double referenceHeight, AreaParameters area) {
        return area.dzeta10() * Math.pow(referenceHeight / 10, -area.alfa());
    }

    /**
     * Rounds half-to-even on the exact binary value, three decimals.
     */
    static double round3(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
