package com.questrail.las.codec.impl;

import com.questrail.las.model.Curve;
import com.questrail.las.model.RawSection;
import com.questrail.las.observability.LasParseSkipEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CurveInfoParserTest
{
    private static Curve line(String text) {
        return CurveInfoParser.parseLine(text).orElseThrow();
    }

    @Test
    void noMiddleTokensGivesEmptyCodes() {
        Curve c = line("DEPT.M : Depth");

        assertEquals("DEPT", c.mnemonic());
        assertEquals("M", c.unit());
        assertEquals("", c.apiCode());
        assertEquals("", c.freeformCode());
        assertEquals("Depth", c.description());
        assertEquals(0, c.length());
    }

    @Test
    void singleMiddleTokenIsApiCode() {
        Curve c = line("GR  .GAPI  31   : Gamma");
        assertEquals("31", c.apiCode());
        assertEquals("", c.freeformCode());
    }

    @Test
    void remainingMiddleTokensAreJoinedIntoCode() {
        Curve c = line(" DT  .US/M  60   520  32 00     :  2  SONIC TRANSIT TIME");

        assertEquals("DT", c.mnemonic());
        assertEquals("US/M", c.unit());
        assertEquals("60", c.apiCode());
        assertEquals("520 32 00", c.freeformCode());
        assertEquals("2  SONIC TRANSIT TIME", c.description());
    }

    @Test
    void unitMayBeEmpty() {
        Curve c = line("CALI.   : Caliper");
        assertEquals("", c.unit());
        assertEquals("Caliper", c.description());
    }

    @Test
    void keepsDuplicatesInFileOrder() {
        RawSection section = new RawSection("C", "~C", List.of(
                "DEPT.M : Depth",
                "GR.GAPI : Gamma",
                "gr.GAPI : Gamma again",
                "nonsense"), 2);

        List<LasParseSkipEvent> skips = new ArrayList<>();
        List<Curve> curves = CurveInfoParser.parse(section, skips::add);

        assertEquals(3, curves.size());
        assertEquals("gr", curves.get(2).mnemonic());
        assertEquals(1, skips.size());
        assertEquals(5, skips.get(0).lineNumber());
    }
}
