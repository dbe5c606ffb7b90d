package com.questrail.las.codec.impl;

import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;
import com.questrail.las.observability.LasParseSkipEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class KeyValueSectionParserTest
{
    private static ParameterRecord line(String text) {
        return KeyValueSectionParser.parseLine(text).orElseThrow();
    }

    @Test
    void parsesUnitValueAndDescription() {
        ParameterRecord r = line(" STRT.M              1670.0000 :START DEPTH");

        assertEquals("STRT", r.mnemonic());
        assertEquals("M", r.unit());
        assertEquals("1670.0000", r.rawValue());
        assertEquals("START DEPTH", r.description());
    }

    @Test
    void valueAfterBlankLandsInUnitSlot() {
        ParameterRecord r = line("NULL. -999.25 : Null");

        assertEquals("-999.25", r.unit());
        assertEquals("", r.rawValue());
        assertEquals("-999.25", r.effectiveValue());
        assertEquals("Null", r.description());
    }

    @Test
    void emptyValueKeepsUnitEmpty() {
        ParameterRecord r = line("UWI .      : UNIQUE WELL ID");

        assertEquals("UWI", r.mnemonic());
        assertEquals("", r.unit());
        assertEquals("", r.effectiveValue());
        assertEquals("UNIQUE WELL ID", r.description());
    }

    @Test
    void descriptionIsOptional() {
        ParameterRecord r = line("COMP.  ACME ");
        assertEquals("ACME", r.effectiveValue());
        assertEquals("", r.description());
    }

    @Test
    void commentsAndBlanksAreIgnoredAndGarbageIsReported() {
        RawSection section = new RawSection("W", "~W", List.of(
                "#MNEM.UNIT  VALUE : DESC",
                "",
                "NULL. -999.25 : Null",
                "this line has no dot",
                "STEP.M 0.5 : Step # every half metre"), 10);

        List<LasParseSkipEvent> skips = new ArrayList<>();
        List<ParameterRecord> records = KeyValueSectionParser.parse(section, skips::add);

        assertEquals(2, records.size());
        assertEquals("Step", records.get(1).description());

        assertEquals(1, skips.size());
        assertEquals("W", skips.get(0).section());
        assertEquals(13, skips.get(0).lineNumber());
        assertEquals("this line has no dot", skips.get(0).line());
    }
}
