package com.phillippitts.windpressure.domain;

/**
 * Wind-exposure regime of a building derived from its height-to-width ratio.
 *
 * <ul>
 *   <li>{@link #ONE}: {@code H <= W}</li>
 *   <li>{@link #TWO}: {@code W < H <= 2W}</li>
 *   <li>{@link #THREE}: {@code H > 2W}</li>
 * </ul>
 */
public enum GeometryIndex {
    ONE(1),
    TWO(2),
    THREE(3);

    private final int value;

    GeometryIndex(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
