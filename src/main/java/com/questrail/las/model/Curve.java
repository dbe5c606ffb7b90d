package com.questrail.las.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Curve
 * -----------------------------------------------------------------------------
 * One named, unit-tagged data series: the metadata of a {@code ~C} line plus
 * the column of values aligned by row index with every other curve.
 *
 * <p>{@code data.get(i)} must always agree with the cell at this curve's
 * column in row {@code i} of the owning {@link LasDocument}. Code outside the
 * synchronizer and mutation engine should treat curves as read-only.</p>
 *
 * <p>The mnemonic can only be changed through
 * {@link LasDocument#renameCurveAt(int, String)} so that the document's
 * lookup index stays in step with it.</p>
 */
public final class Curve
{
    private String mnemonic;
    private String unit;
    private final String apiCode;
    private final String freeformCode;
    private String description;
    private final List<Double> data = new ArrayList<>();

    public Curve(String mnemonic, String unit, String apiCode, String freeformCode, String description) {
        this.mnemonic = requireMnemonic(mnemonic);
        this.unit = nullToEmpty(unit);
        this.apiCode = nullToEmpty(apiCode);
        this.freeformCode = nullToEmpty(freeformCode);
        this.description = nullToEmpty(description);
    }

    /**
     * Placeholder curve for a table column that has no {@code ~C} definition.
     *
     * @param position 1-based column position
     */
    public static Curve positional(int position) {
        return new Curve("CURVE" + position, "", "", "", "");
    }

    public String mnemonic() {
        return mnemonic;
    }

    public String unit() {
        return unit;
    }

    public String apiCode() {
        return apiCode;
    }

    public String freeformCode() {
        return freeformCode;
    }

    public String description() {
        return description;
    }

    /**
     * Read-only view of the column values; {@code null} is logical null.
     */
    public List<Double> data() {
        return Collections.unmodifiableList(data);
    }

    public int length() {
        return data.size();
    }

    /**
     * Value at {@code row}, or {@code null} past the end of the column.
     */
    public Double valueAt(int row) {
        return row < data.size() ? data.get(row) : null;
    }

    public void setUnit(String unit) {
        this.unit = nullToEmpty(unit);
    }

    public void setDescription(String description) {
        this.description = nullToEmpty(description);
    }

    /**
     * Replaces the whole column.
     */
    public void replaceData(List<Double> values) {
        Objects.requireNonNull(values, "values");
        data.clear();
        data.addAll(values);
    }

    /**
     * Extends the column with nulls up to {@code length}; never shortens.
     */
    public void padTo(int length) {
        while (data.size() < length) {
            data.add(null);
        }
    }

    void rename(String newMnemonic) {
        this.mnemonic = requireMnemonic(newMnemonic);
    }

    private static String requireMnemonic(String mnemonic) {
        Objects.requireNonNull(mnemonic, "mnemonic");
        if (mnemonic.isBlank()) {
            throw new IllegalArgumentException("mnemonic must not be blank");
        }
        return mnemonic;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return "Curve[" + mnemonic + (unit.isEmpty() ? "" : "." + unit) + ", length=" + data.size() + ']';
    }
}
