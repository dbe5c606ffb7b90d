package com.questrail.las.observability;

import com.questrail.las.model.Delimiter;

/**
 * Summary of a completed load.
 *
 * @param sectionCount number of sections found, preamble included
 * @param curveCount   curves in the resulting document
 * @param rowCount     rows in the resulting document
 * @param delimiter    resolved table delimiter
 * @param nullValue    resolved null sentinel, or {@code null} if none
 * @param skippedLines lines ignored by the section grammars
 */
public record LasLoadEvent(
    int sectionCount,
    int curveCount,
    int rowCount,
    Delimiter delimiter,
    Double nullValue,
    int skippedLines
) {
}
