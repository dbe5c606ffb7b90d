package com.questrail.las.codec.impl;

import com.questrail.las.model.Delimiter;
import com.questrail.las.model.LasDocument;
import com.questrail.las.model.LasSections;
import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;

import java.util.Optional;

/**
 * DelimiterNullResolver
 * -----------------------------------------------------------------------------
 * Decides how the {@code ~A} table is split and which value marks "no
 * measurement".
 *
 * <h2>Delimiter</h2>
 * First match wins:
 * <ol>
 *   <li>{@code DLM} in {@code ~V}, if it names SPACE, TAB or COMMA</li>
 *   <li>{@code DLM} in {@code ~W}, same rule</li>
 *   <li>the first non-empty data line: a comma means COMMA, a tab means TAB</li>
 *   <li>SPACE</li>
 * </ol>
 *
 * <h2>Null value</h2>
 * {@code NULL} in {@code ~W}, parsed as a number. Anything else leaves the
 * sentinel unresolved.
 */
final class DelimiterNullResolver
{
    private DelimiterNullResolver() {}

    static Delimiter resolveDelimiter(LasDocument document) {
        Optional<Delimiter> declared = declared(document.versionParam("DLM"));
        if (declared.isPresent()) {
            return declared.get();
        }
        declared = declared(document.wellParam("DLM"));
        if (declared.isPresent()) {
            return declared.get();
        }
        return document.section(LasSections.ASCII)
                .map(DelimiterNullResolver::sniff)
                .orElse(Delimiter.SPACE);
    }

    static Double resolveNullValue(LasDocument document) {
        Optional<ParameterRecord> item = document.wellParam("NULL");
        if (item.isEmpty()) {
            return null;
        }
        Double v = AsciiDataParser.parseLenient(item.get().effectiveValue());
        return (v != null && Double.isFinite(v)) ? v : null;
    }

    private static Optional<Delimiter> declared(Optional<ParameterRecord> record) {
        return record.flatMap(r -> Delimiter.fromDeclared(r.effectiveValue()));
    }

    static Delimiter sniff(RawSection ascii) {
        for (String raw : ascii.lines()) {
            String line = LasLines.stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.indexOf(',') >= 0) {
                return Delimiter.COMMA;
            }
            if (line.indexOf('\t') >= 0) {
                return Delimiter.TAB;
            }
            return Delimiter.SPACE;
        }
        return Delimiter.SPACE;
    }
}
