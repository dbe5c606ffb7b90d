package com.questrail.las.api;

/**
 * Read-only description of a curve, enough to populate a selector.
 *
 * @param mnemonic curve mnemonic
 * @param unit     unit, may be empty
 * @param length   number of values in the curve
 */
public record CurveSummary(
        String mnemonic,
        String unit,
        int length
) {
    /**
     * {@code "MNEM (UNIT)"}, or just the mnemonic when the unit is empty.
     */
    public String label() {
        return unit.isEmpty() ? mnemonic : mnemonic + " (" + unit + ")";
    }
}
