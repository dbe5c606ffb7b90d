package com.questrail.las.codec.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * LasLines
 * -----------------------------------------------------------------------------
 * Line-level text rules shared by every LAS grammar.
 *
 * <ul>
 *   <li>Line endings: {@code \r\n}, {@code \r} and {@code \n} are all accepted;
 *       the first one found is remembered for export.</li>
 *   <li>Comments: a line whose first non-blank character is {@code #} is a
 *       comment; on any other line, {@code #} starts a trailing comment.</li>
 * </ul>
 *
 * Comments are removed only when a grammar looks at a line. Raw section lines
 * keep them verbatim.
 */
final class LasLines
{
    static final char BOM = '﻿';

    private LasLines() {}

    /**
     * Returns the first line ending used in {@code text}: {@code "\r\n"} if
     * present anywhere, else {@code "\r"} if present, else {@code "\n"}.
     */
    static String detectLineEnding(String text) {
        if (text.contains("\r\n")) {
            return "\r\n";
        }
        if (text.indexOf('\r') >= 0) {
            return "\r";
        }
        return "\n";
    }

    /**
     * Splits text into lines after normalizing line endings and dropping a
     * leading byte-order mark. A final line ending does not produce an
     * extra empty line.
     */
    static List<String> split(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (!normalized.isEmpty() && normalized.charAt(0) == BOM) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(normalized.split("\n", -1)));
        if (normalized.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    static boolean isCommentLine(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == '#';
            }
        }
        return false;
    }

    /**
     * Returns the line with any comment removed; a pure comment line becomes empty.
     */
    static String stripComment(String line) {
        int hash = line.indexOf('#');
        if (hash < 0) {
            return line;
        }
        if (isCommentLine(line)) {
            return "";
        }
        return line.substring(0, hash);
    }
}
