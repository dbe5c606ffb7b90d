package com.questrail.las.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LasDocumentTests
{
    private static LasDocument twoByTwo() {
        LasDocument doc = new LasDocument();
        doc.addCurve(new Curve("DEPT", "M", "", "", "Depth"));
        doc.addCurve(new Curve("GR", "GAPI", "", "", "Gamma"));
        doc.replaceTable(List.of(DataRow.of(List.of(100.0, 50.0)), DataRow.of(List.of(101.0, 60.0))));
        return doc;
    }

    @Test
    void lookupIgnoresCase() {
        LasDocument doc = twoByTwo();
        assertEquals(1, doc.indexOf("gr").getAsInt());
        assertEquals("GR", doc.curve("Gr").orElseThrow().mnemonic());
        assertTrue(doc.indexOf("RHOB").isEmpty());
    }

    @Test
    void removeColumnDropsMetadataAndCells() {
        LasDocument doc = twoByTwo();
        Curve removed = doc.removeColumnAt(0);

        assertEquals("DEPT", removed.mnemonic());
        assertEquals(1, doc.curveCount());
        assertEquals(List.of(50.0), doc.rowAt(0).values());
        assertEquals(0, doc.indexOf("GR").getAsInt());
    }

    @Test
    void renameKeepsIndexCurrent() {
        LasDocument doc = twoByTwo();
        doc.renameCurveAt(1, "GAMMA");

        assertTrue(doc.indexOf("GR").isEmpty());
        assertEquals(1, doc.indexOf("gamma").getAsInt());
    }

    @Test
    void laterSectionWinsLookupButBothAreKept() {
        LasDocument doc = new LasDocument();
        doc.addRawSection(new RawSection("O", "~O first", List.of("a"), 2));
        doc.addRawSection(new RawSection("O", "~O second", List.of("b"), 4));

        assertEquals("~O second", doc.section(LasSections.OTHER).orElseThrow().headerLine());
        assertEquals(2, doc.sections().size());
    }

    @Test
    void keyValueLookupIgnoresCase() {
        LasDocument doc = new LasDocument();
        doc.putWellParam(new ParameterRecord("Null", "-999.25", "", ""));
        assertTrue(doc.wellParam("NULL").isPresent());
    }

    @Test
    void nullValueMustBeFinite() {
        LasDocument doc = new LasDocument();
        assertThrows(IllegalArgumentException.class, () -> doc.setNullValue(Double.NaN));
        doc.setNullValue(-999.25);
        assertEquals(-999.25, doc.nullValue().getAsDouble());
        doc.setNullValue(null);
        assertTrue(doc.nullValue().isEmpty());
    }

    @Test
    void resizeTableAppendsAbsentRows() {
        LasDocument doc = twoByTwo();
        doc.resizeTable(3, 2);

        assertEquals(3, doc.rowCount());
        assertFalse(doc.rowAt(2).isAssigned(0));

        doc.resizeTable(1, 2);
        assertEquals(1, doc.rowCount());
    }
}
