package com.questrail.las.model;

import java.util.List;
import java.util.Objects;

/**
 * RawSection
 * -----------------------------------------------------------------------------
 * A section of LAS text exactly as it appeared in the source: the
 * {@code ~}-prefixed header line plus every following line up to the next
 * header, comment lines included.
 *
 * <p>Lines appearing before the first header are collected into a synthetic
 * section named {@link LasSections#PRE} whose header line is empty.</p>
 *
 * @param name            upper-cased first token of the header ({@code "V"}, {@code "CURVE"}, ...)
 * @param headerLine      the header line verbatim
 * @param lines           body lines verbatim, without line terminators
 * @param firstLineNumber 1-based source line number of the first body line
 */
public record RawSection(
        String name,
        String headerLine,
        List<String> lines,
        int firstLineNumber
) {
    public RawSection {
        Objects.requireNonNull(name, "name");
        headerLine = headerLine == null ? "" : headerLine;
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }

    /**
     * True for the synthetic section holding text that precedes the first header.
     */
    public boolean isPreamble() {
        return LasSections.PRE.equals(name);
    }
}
