package com.questrail.las.codec;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

final class LasNumberFormatTest
{
    @Test
    void plainFormDropsTrailingZerosAndNeverUsesExponents() {
        assertEquals("100", LasNumberFormat.plain(100.0));
        assertEquals("55.2", LasNumberFormat.plain(55.2));
        assertEquals("0.0001", LasNumberFormat.plain(0.0001));
        assertEquals("1670", LasNumberFormat.plain(1670.000));
        assertEquals("10000000000", LasNumberFormat.plain(1e10));
        assertEquals("0", LasNumberFormat.plain(-0.0));
    }

    @Test
    void nullCellUsesSentinelOrNaN() {
        assertEquals("-999.25", LasNumberFormat.cell(null, OptionalDouble.of(-999.25), null));
        assertEquals("NaN", LasNumberFormat.cell(null, OptionalDouble.empty(), 3));
        assertEquals("-999.25", LasNumberFormat.cell(Double.POSITIVE_INFINITY, OptionalDouble.of(-999.25), null));
    }

    @Test
    void fixedPrecisionRoundsHalfUp() {
        assertEquals("0.13", LasNumberFormat.cell(0.125, OptionalDouble.empty(), 2));
        assertEquals("3", LasNumberFormat.fixed(2.5, 0));
        assertEquals("100.0000", LasNumberFormat.fixed(100, 4));
    }

    @Test
    void negativeZeroIsSuppressed() {
        assertEquals("0.00", LasNumberFormat.fixed(-0.0001, 2));
        assertEquals("0", LasNumberFormat.fixed(-0.2, 0));
        assertEquals("-0.01", LasNumberFormat.fixed(-0.01, 2));
    }

    @Test
    void negativePrecisionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LasNumberFormat.fixed(1.0, -1));
    }
}
