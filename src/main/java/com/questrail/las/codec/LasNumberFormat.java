package com.questrail.las.codec;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * LasNumberFormat
 * -----------------------------------------------------------------------------
 * Text form of table cells on export.
 *
 * <ul>
 *   <li>null or non-finite → the null sentinel's text, or {@code NaN} when
 *       the document declares no sentinel</li>
 *   <li>finite with a precision → fixed-point with that many fraction digits;
 *       a negative zero result ({@code -0.00}) is written as positive</li>
 *   <li>finite without a precision → shortest plain decimal: {@code 100},
 *       {@code 55.2}, {@code 0.0001}; never exponent notation, never a
 *       trailing {@code .0}</li>
 * </ul>
 */
public final class LasNumberFormat
{
    /** Written for a null cell when no sentinel is resolved. */
    public static final String NAN_TOKEN = "NaN";

    private static final Pattern NEGATIVE_ZERO = Pattern.compile("^-0(\\.0*)?$");

    private LasNumberFormat() {}

    /**
     * Formats one cell.
     *
     * @param value     cell value, {@code null} for logical null
     * @param nullValue resolved sentinel, possibly empty
     * @param precision fraction digits, or {@code null} for the plain form
     */
    public static String cell(Double value, OptionalDouble nullValue, Integer precision) {
        if (value == null || !Double.isFinite(value)) {
            return nullValue.isPresent() ? plain(nullValue.getAsDouble()) : NAN_TOKEN;
        }
        if (precision == null) {
            return plain(value);
        }
        return fixed(value, precision);
    }

    /**
     * Shortest plain decimal text of a finite value.
     */
    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            return NAN_TOKEN;
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Fixed-point text with {@code precision} fraction digits.
     */
    public static String fixed(double value, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0: " + precision);
        }
        String s = String.format(Locale.ROOT, "%." + precision + "f", value);
        return NEGATIVE_ZERO.matcher(s).matches() ? s.substring(1) : s;
    }
}
