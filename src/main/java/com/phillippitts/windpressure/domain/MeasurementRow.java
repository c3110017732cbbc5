package com.phillippitts.windpressure.domain;

/**
 * One measurement point: pressure at a surface location.
 *
 * @param pressure pressure value (Pa)
 * @param x        X coordinate (m)
 * @param y        Y coordinate (m)
 * @param z        Z coordinate (m), height above ground
 */
public record MeasurementRow(double pressure, double x, double y, double z) {

    /**
     * Returns a copy with the pressure replaced; coordinates are kept.
     */
    public MeasurementRow withPressure(double corrected) {
        return new MeasurementRow(corrected, x, y, z);
    }
}
