package com.questrail.las.internal.sync;

import com.questrail.las.model.Curve;
import com.questrail.las.model.DataRow;
import com.questrail.las.model.LasDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * CurveRowSynchronizer
 * -----------------------------------------------------------------------------
 * Keeps the two views of the numeric data in a {@link LasDocument} in step:
 * the row-major table and the per-curve columns.
 *
 * <h2>Direction</h2>
 * <ul>
 *   <li><b>Load</b> ({@link #distribute}): the table is authoritative and
 *       curve data is rebuilt from it.</li>
 *   <li><b>Mutation</b> ({@link #reconcile}): curve data is authoritative
 *       for cells the table has never held; cells already assigned in the
 *       table are left alone.</li>
 *   <li><b>Derive / edit</b> ({@link #writeColumn}): one column is pushed
 *       from its curve into every row.</li>
 *   <li><b>Export</b> ({@link #rowsFromCurves}): a fresh row view built only
 *       from curve data.</li>
 * </ul>
 *
 * <h2>Postcondition</h2>
 * After {@code distribute} or {@code reconcile}, every row has one cell per
 * curve and every curve has one value per row ({@link #assertAligned}).
 *
 * Stateless.
 */
public final class CurveRowSynchronizer
{
    private CurveRowSynchronizer() {}

    /**
     * Load path. Synthesizes {@code CURVE1..n} when the document has no curve
     * metadata, pads short rows with nulls, truncates long rows and rebuilds
     * every curve's data from the table.
     */
    public static void distribute(LasDocument document) {
        if (document.curveCount() == 0 && document.rowCount() > 0) {
            int width = document.rowAt(0).size();
            for (int i = 0; i < width; i++) {
                document.addCurve(Curve.positional(i + 1));
            }
        }

        final int width = document.curveCount();
        for (DataRow row : document.rows()) {
            row.padWithNulls(width);
        }

        for (int c = 0; c < width; c++) {
            List<Double> column = new ArrayList<>(document.rowCount());
            for (DataRow row : document.rows()) {
                column.add(row.get(c));
            }
            document.curveAt(c).replaceData(column);
        }
    }

    /**
     * Mutation path. Resizes the table to the longest curve and the current
     * curve count, fills absent cells from curve data and null-pads short
     * curves. Assigned cells, explicit nulls included, are never overwritten.
     */
    public static void reconcile(LasDocument document) {
        final int width = document.curveCount();
        int rowCount = 0;
        for (Curve c : document.curves()) {
            rowCount = Math.max(rowCount, c.length());
        }

        document.resizeTable(rowCount, width);

        for (int r = 0; r < rowCount; r++) {
            DataRow row = document.rowAt(r);
            if (row.size() != width) {
                row.resize(width);
            }
            for (int c = 0; c < width; c++) {
                if (!row.isAssigned(c)) {
                    row.set(c, document.curveAt(c).valueAt(r));
                }
            }
        }

        for (Curve c : document.curves()) {
            c.padTo(rowCount);
        }
    }

    /**
     * Writes curve {@code column}'s data into that cell of every row.
     */
    public static void writeColumn(LasDocument document, int column) {
        Curve curve = document.curveAt(column);
        for (int r = 0; r < document.rowCount(); r++) {
            document.rowAt(r).set(column, curve.valueAt(r));
        }
    }

    /**
     * Builds rows from curve data alone; the table is not consulted.
     * Row count is the longest curve; short curves read as null.
     */
    public static List<List<Double>> rowsFromCurves(LasDocument document) {
        int rowCount = 0;
        for (Curve c : document.curves()) {
            rowCount = Math.max(rowCount, c.length());
        }

        List<List<Double>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<Double> row = new ArrayList<>(document.curveCount());
            for (Curve c : document.curves()) {
                row.add(c.valueAt(r));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Throws {@link IllegalStateException} if the table and the curves
     * disagree in shape or in any cell.
     */
    public static void assertAligned(LasDocument document) {
        final int width = document.curveCount();
        final int rows = document.rowCount();

        for (Curve c : document.curves()) {
            if (c.length() != rows) {
                throw new IllegalStateException(
                        "curve " + c.mnemonic() + " has " + c.length() + " values, table has " + rows + " rows");
            }
        }
        for (int r = 0; r < rows; r++) {
            DataRow row = document.rowAt(r);
            if (row.size() != width) {
                throw new IllegalStateException("row " + r + " has " + row.size() + " cells, expected " + width);
            }
            for (int c = 0; c < width; c++) {
                Double cell = row.get(c);
                Double value = document.curveAt(c).valueAt(r);
                if (cell == null ? value != null : !cell.equals(value)) {
                    throw new IllegalStateException("row " + r + ", column " + c + ": table=" + cell + ", curve=" + value);
                }
            }
        }
    }
}
