package com.questrail.las.codec;

import com.questrail.las.config.WriterOptions;
import com.questrail.las.model.LasDocument;

/**
 * LasDocumentWriter
 * -----------------------------------------------------------------------------
 * Outbound counterpart of {@link LasDocumentReader}.
 *
 * <p>The curve definitions and the numeric table are always regenerated from
 * the document's curves; header and free-text sections are passed through
 * from their raw lines with targeted updates.</p>
 */
public interface LasDocumentWriter
{
    /**
     * Serializes a document. The document is not modified.
     *
     * @param document document to write
     * @param options  delimiter, precision and line-ending overrides
     * @return complete LAS text, terminated by a line ending
     */
    String write(LasDocument document, WriterOptions options);
}
