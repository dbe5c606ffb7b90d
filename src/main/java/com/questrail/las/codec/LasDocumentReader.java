package com.questrail.las.codec;

import com.questrail.las.model.LasDocument;

/**
 * LasDocumentReader
 * -----------------------------------------------------------------------------
 * Text-level reader for LAS.
 *
 * <p>This interface defines the inbound boundary between the raw text of a
 * file and a structured {@link LasDocument}.</p>
 *
 * <p>The reader is responsible for:</p>
 * <ul>
 *   <li>Splitting the text into sections</li>
 *   <li>Parsing header, parameter and curve definition lines</li>
 *   <li>Resolving the table delimiter and the null sentinel</li>
 *   <li>Reading the numeric table and distributing it into curves</li>
 * </ul>
 *
 * <p>The reader is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>File or network I/O</li>
 *   <li>Validating a file against any particular vendor profile</li>
 *   <li>Rejecting input: malformed lines are skipped and reported, never thrown</li>
 * </ul>
 */
public interface LasDocumentReader
{
    /**
     * Builds a document from the complete text of one file.
     *
     * @param text file contents, any line ending
     * @return a new document; never {@code null}, possibly with fewer curves
     *         or rows than the text nominally declares
     */
    LasDocument read(String text);
}
