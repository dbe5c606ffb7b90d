/**
 * LAS Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for LAS text: the
 * rules that turn a sectioned text file into a {@link com.questrail.las.model.LasDocument}
 * and back.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String text
 *        → LasDocumentReader     (sections, grammars, delimiter/null resolution)
 *            → LasDocument       (curves and rows in agreement)
 *                → mutation engine
 *            → LasDocumentWriter
 *        → String text
 * </pre>
 *
 * <h2>Tolerance</h2>
 * <p>LAS files in the field are frequently non-conformant. The reader skips
 * what it cannot parse and reports each skipped line to the
 * {@link com.questrail.las.observability.LasObservabilitySink}; loading never
 * fails because of malformed content.</p>
 *
 * <h2>Round trip</h2>
 * <p>Curve mnemonics, units and values survive a write/read cycle. The
 * whitespace layout of the numeric table does not.</p>
 */
package com.questrail.las.codec;
