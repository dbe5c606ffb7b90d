package com.questrail.las.api;

/**
 * Elementwise in-place edit of a curve's values.
 */
@FunctionalInterface
public interface CurveEdit
{
    /**
     * @param value current value, {@code null} for logical null
     * @param row   0-based row index
     * @return the new value; {@code null} or a non-finite result stores logical null
     */
    Double apply(Double value, int row);
}
