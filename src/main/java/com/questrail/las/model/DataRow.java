package com.questrail.las.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DataRow
 * -----------------------------------------------------------------------------
 * One depth step of the row-major table: a cell per curve, each holding a
 * number or logical null.
 *
 * <h2>Assigned vs absent</h2>
 * A cell is either <em>assigned</em> (it holds a value, possibly an explicit
 * null) or <em>absent</em> (it exists only because the row was widened and
 * nothing has been written to it yet). Two parallel structures carry this:
 * <pre>
 * assigned = false               → absent, reads as null
 * assigned = true,  cell = null  → explicit logical null
 * assigned = true,  cell = v     → value v
 * </pre>
 *
 * The synchronizer fills absent cells from curve data and never overwrites
 * an assigned one.
 *
 * <h2>Mutability</h2>
 * Mutable; no thread-safety guarantees.
 */
public final class DataRow
{
    private final List<Double> cells;
    private final BitSet assigned;

    private DataRow(List<Double> cells, BitSet assigned) {
        this.cells = cells;
        this.assigned = assigned;
    }

    /**
     * Creates a row whose cells are all assigned from {@code values}
     * ({@code null} elements are explicit logical nulls).
     */
    public static DataRow of(List<Double> values) {
        Objects.requireNonNull(values, "values");
        BitSet bits = new BitSet(values.size());
        bits.set(0, values.size());
        return new DataRow(new ArrayList<>(values), bits);
    }

    /**
     * Creates a row with {@code width} absent cells.
     */
    public static DataRow absent(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0: " + width);
        }
        return new DataRow(new ArrayList<>(Collections.nCopies(width, null)), new BitSet(width));
    }

    public int size() {
        return cells.size();
    }

    /**
     * Returns the cell value; absent cells read as {@code null}.
     */
    public Double get(int column) {
        return cells.get(column);
    }

    public boolean isAssigned(int column) {
        checkColumn(column);
        return assigned.get(column);
    }

    /**
     * Assigns a cell. {@code null} records an explicit logical null.
     */
    public void set(int column, Double value) {
        checkColumn(column);
        cells.set(column, value);
        assigned.set(column);
    }

    /**
     * Widens with absent cells or truncates trailing cells.
     */
    public void resize(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0: " + width);
        }
        while (cells.size() > width) {
            cells.remove(cells.size() - 1);
        }
        assigned.clear(width, Math.max(width, assigned.length()));
        while (cells.size() < width) {
            cells.add(null);
        }
    }

    /**
     * Widens with assigned nulls or truncates trailing cells.
     */
    public void padWithNulls(int width) {
        int before = cells.size();
        resize(width);
        if (width > before) {
            assigned.set(before, width);
        }
    }

    /**
     * Removes one column, shifting later cells (and their assigned flags) left.
     */
    public void removeColumn(int column) {
        checkColumn(column);
        cells.remove(column);
        int last = cells.size();
        for (int i = column; i < last; i++) {
            assigned.set(i, assigned.get(i + 1));
        }
        assigned.clear(last);
    }

    /**
     * Returns a snapshot of the cell values.
     */
    public List<Double> values() {
        return Collections.unmodifiableList(new ArrayList<>(cells));
    }

    private void checkColumn(int column) {
        if (column < 0 || column >= cells.size()) {
            throw new IndexOutOfBoundsException("column=" + column + ", width=" + cells.size());
        }
    }

    @Override
    public String toString() {
        return "DataRow" + cells;
    }
}
