package com.questrail.las.codec.impl;

import com.questrail.las.model.Delimiter;
import com.questrail.las.model.LasDocument;
import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DelimiterNullResolverTest
{
    private static LasDocument withAscii(String... lines) {
        LasDocument doc = new LasDocument();
        doc.addRawSection(new RawSection("A", "~A", List.of(lines), 2));
        return doc;
    }

    @Test
    void versionDeclarationWins() {
        LasDocument doc = withAscii("1\t2");
        doc.putVersionParam(new ParameterRecord("DLM", "COMMA", "", "Delimiter"));
        doc.putWellParam(new ParameterRecord("DLM", "TAB", "", ""));

        assertEquals(Delimiter.COMMA, DelimiterNullResolver.resolveDelimiter(doc));
    }

    @Test
    void unknownVersionDeclarationFallsThroughToWell() {
        LasDocument doc = withAscii("1 2");
        doc.putVersionParam(new ParameterRecord("DLM", "PIPE", "", ""));
        doc.putWellParam(new ParameterRecord("DLM", "", "tab", ""));

        assertEquals(Delimiter.TAB, DelimiterNullResolver.resolveDelimiter(doc));
    }

    @Test
    void sniffsFirstDataLine() {
        assertEquals(Delimiter.COMMA, DelimiterNullResolver.resolveDelimiter(withAscii("# header", "", "1, 2", "3\t4")));
        assertEquals(Delimiter.TAB, DelimiterNullResolver.resolveDelimiter(withAscii("1\t2")));
        assertEquals(Delimiter.SPACE, DelimiterNullResolver.resolveDelimiter(withAscii("1  2")));
    }

    @Test
    void defaultsToSpaceWithoutData() {
        assertEquals(Delimiter.SPACE, DelimiterNullResolver.resolveDelimiter(new LasDocument()));
        assertEquals(Delimiter.SPACE, DelimiterNullResolver.resolveDelimiter(withAscii("", "# nothing")));
    }

    @Test
    void nullValueComesFromWellSection() {
        LasDocument doc = new LasDocument();
        doc.putWellParam(new ParameterRecord("NULL", "-999.25", "", "Null"));
        assertEquals(-999.25, DelimiterNullResolver.resolveNullValue(doc));
    }

    @Test
    void unparseableOrMissingNullStaysUnresolved() {
        LasDocument doc = new LasDocument();
        assertNull(DelimiterNullResolver.resolveNullValue(doc));

        doc.putWellParam(new ParameterRecord("NULL", "", "none", ""));
        assertNull(DelimiterNullResolver.resolveNullValue(doc));
    }
}
