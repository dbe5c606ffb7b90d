package com.questrail.las.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LasLinesTest
{
    @Test
    void detectsFirstLineEndingStyle() {
        assertEquals("\r\n", LasLines.detectLineEnding("a\r\nb\nc"));
        assertEquals("\r", LasLines.detectLineEnding("a\rb"));
        assertEquals("\n", LasLines.detectLineEnding("a\nb"));
        assertEquals("\n", LasLines.detectLineEnding("single"));
    }

    @Test
    void splitNormalizesEndingsAndDropsFinalEmptyLine() {
        assertEquals(List.of("a", "b", "c"), LasLines.split("a\r\nb\rc\n"));
        assertEquals(List.of("a", "", "b"), LasLines.split("a\n\nb"));
        assertTrue(LasLines.split("").isEmpty());
    }

    @Test
    void splitStripsByteOrderMark() {
        assertEquals(List.of("~V"), LasLines.split(LasLines.BOM + "~V\n"));
    }

    @Test
    void commentLinesBecomeEmpty() {
        assertTrue(LasLines.isCommentLine("   # note"));
        assertEquals("", LasLines.stripComment("#MNEM.UNIT"));
    }

    @Test
    void trailingCommentIsCut() {
        assertEquals("GR .GAPI : Gamma ", LasLines.stripComment("GR .GAPI : Gamma # tool 2"));
        assertEquals("no comment", LasLines.stripComment("no comment"));
    }
}
