package com.questrail.las.model;

import java.util.Objects;

/**
 * One {@code MNEM.UNIT VALUE : DESCRIPTION} line of a key-value section
 * ({@code ~V}, {@code ~W}, {@code ~P}).
 *
 * <p>The line grammar places the first token after the dot into the unit
 * slot, so a line such as {@code NULL. -999.25 : Null value} carries its
 * value as {@link #unit()} and an empty {@link #rawValue()}.
 * {@link #effectiveValue()} hides that quirk from callers that only care
 * about the value.</p>
 *
 * @param mnemonic    mnemonic as written (case preserved)
 * @param unit        token immediately following the dot, may be empty
 * @param rawValue    text between the unit and the colon, trimmed, may be empty
 * @param description text after the colon, trimmed, may be empty
 */
public record ParameterRecord(
        String mnemonic,
        String unit,
        String rawValue,
        String description
) {
    public ParameterRecord {
        Objects.requireNonNull(mnemonic, "mnemonic");
        unit = unit == null ? "" : unit;
        rawValue = rawValue == null ? "" : rawValue;
        description = description == null ? "" : description;
    }

    /**
     * Returns {@link #rawValue()} when present, otherwise {@link #unit()}.
     */
    public String effectiveValue() {
        return rawValue.isBlank() ? unit : rawValue;
    }

    /**
     * True when the value was written in the unit slot ({@code MNEM. VALUE : ...}).
     */
    public boolean valueInUnitSlot() {
        return rawValue.isBlank();
    }
}
