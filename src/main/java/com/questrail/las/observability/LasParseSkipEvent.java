package com.questrail.las.observability;

/**
 * A line the reader ignored because it did not match the grammar of its section.
 *
 * <p>Field files are commonly non-conformant, so skips are never errors; they
 * are only reported.</p>
 *
 * @param section    upper-cased section name
 * @param lineNumber 1-based line number in the source text
 * @param line       the line verbatim
 * @param reason     short human-readable cause
 */
public record LasParseSkipEvent(
    String section,
    int lineNumber,
    String line,
    String reason
) {
}
