package com.questrail.las.internal.sync;

import com.questrail.las.model.Curve;
import com.questrail.las.model.DataRow;
import com.questrail.las.model.LasDocument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CurveRowSynchronizerTest
{
    @SafeVarargs
    private static LasDocument table(List<Double>... rows) {
        LasDocument doc = new LasDocument();
        List<DataRow> dataRows = new ArrayList<>();
        for (List<Double> r : rows) {
            dataRows.add(DataRow.of(r));
        }
        doc.replaceTable(dataRows);
        return doc;
    }

    private static Curve curve(String name, Double... values) {
        Curve c = new Curve(name, "", "", "", "");
        c.replaceData(Arrays.asList(values));
        return c;
    }

    @Test
    void distributeSynthesizesPositionalCurves() {
        LasDocument doc = table(List.of(1.0, 2.0), List.of(3.0, 4.0));

        CurveRowSynchronizer.distribute(doc);

        assertEquals(2, doc.curveCount());
        assertEquals("CURVE1", doc.curveAt(0).mnemonic());
        assertEquals(List.of(2.0, 4.0), doc.curveAt(1).data());
        CurveRowSynchronizer.assertAligned(doc);
    }

    @Test
    void distributeWidensWithNullsAndTruncates() {
        LasDocument doc = table(List.of(1.0), List.of(2.0, 3.0, 4.0));
        doc.addCurve(new Curve("A", "", "", "", ""));
        doc.addCurve(new Curve("B", "", "", "", ""));

        CurveRowSynchronizer.distribute(doc);

        assertEquals(Arrays.asList(null, 3.0), doc.curveAt(1).data());
        assertEquals(2, doc.rowAt(1).size());
        assertTrue(doc.rowAt(0).isAssigned(1));
    }

    @Test
    void distributeWithNoRowsEmptiesCurves() {
        LasDocument doc = new LasDocument();
        doc.addCurve(curve("A", 1.0));

        CurveRowSynchronizer.distribute(doc);

        assertEquals(0, doc.curveAt(0).length());
    }

    @Test
    void reconcileFillsAbsentCellsFromCurves() {
        LasDocument doc = table(List.of(100.0), List.of(200.0));
        doc.addCurve(curve("DEPT", 100.0, 200.0));
        doc.addCurve(curve("NEW", 1.0, 2.0));

        CurveRowSynchronizer.reconcile(doc);

        assertEquals(List.of(100.0, 1.0), doc.rowAt(0).values());
        assertEquals(List.of(200.0, 2.0), doc.rowAt(1).values());
        CurveRowSynchronizer.assertAligned(doc);
    }

    @Test
    void reconcileNeverOverwritesAssignedCells() {
        LasDocument doc = table(Arrays.asList(100.0, null));
        doc.addCurve(curve("DEPT", 100.0));
        doc.addCurve(curve("GR", 42.0));

        CurveRowSynchronizer.reconcile(doc);

        assertNull(doc.rowAt(0).get(1), "explicit null in the table stays null");
    }

    @Test
    void reconcileGrowsTableAndPadsShortCurves() {
        LasDocument doc = table(List.of(1.0));
        doc.addCurve(curve("A", 1.0));
        doc.addCurve(curve("B", 5.0, 6.0, 7.0));

        CurveRowSynchronizer.reconcile(doc);

        assertEquals(3, doc.rowCount());
        assertEquals(Arrays.asList(1.0, null, null), doc.curveAt(0).data());
        assertEquals(Arrays.asList(null, 7.0), doc.rowAt(2).values());
        CurveRowSynchronizer.assertAligned(doc);
    }

    @Test
    void reconcileWithNoCurvesEmptiesTable() {
        LasDocument doc = table(List.of(1.0));
        CurveRowSynchronizer.reconcile(doc);
        assertEquals(0, doc.rowCount());
    }

    @Test
    void writeColumnOverwritesAssignedCells() {
        LasDocument doc = table(List.of(1.0, 10.0), List.of(2.0, 20.0));
        doc.addCurve(curve("A", 1.0, 2.0));
        doc.addCurve(curve("B", 11.0, 22.0));

        CurveRowSynchronizer.writeColumn(doc, 1);

        assertEquals(List.of(1.0, 11.0), doc.rowAt(0).values());
        assertEquals(List.of(2.0, 22.0), doc.rowAt(1).values());
    }

    @Test
    void rowsFromCurvesIgnoresTable() {
        LasDocument doc = table(List.of(9.0, 9.0));
        doc.addCurve(curve("A", 1.0, 2.0));
        doc.addCurve(curve("B", 3.0));

        List<List<Double>> rows = CurveRowSynchronizer.rowsFromCurves(doc);

        assertEquals(2, rows.size());
        assertEquals(List.of(1.0, 3.0), rows.get(0));
        assertEquals(Arrays.asList(2.0, null), rows.get(1));
    }

    @Test
    void assertAlignedDetectsDisagreement() {
        LasDocument doc = table(List.of(1.0));
        doc.addCurve(curve("A", 2.0));

        assertThrows(IllegalStateException.class, () -> CurveRowSynchronizer.assertAligned(doc));
    }
}
