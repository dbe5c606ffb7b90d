package com.questrail.las;

import com.questrail.las.api.CurveEdit;
import com.questrail.las.api.CurveSummary;
import com.questrail.las.api.DeriveOutcome;
import com.questrail.las.api.OperatorExpression;
import com.questrail.las.api.PetrophysicalOutcome;
import com.questrail.las.api.PetrophysicalParameters;
import com.questrail.las.api.RenameOutcome;
import com.questrail.las.codec.LasDocumentReader;
import com.questrail.las.codec.LasDocumentWriter;
import com.questrail.las.codec.impl.DefaultLasDocumentReader;
import com.questrail.las.codec.impl.DefaultLasDocumentWriter;
import com.questrail.las.config.EditorConfig;
import com.questrail.las.config.WriterOptions;
import com.questrail.las.internal.mutate.CurveMutationEngine;
import com.questrail.las.model.Curve;
import com.questrail.las.model.LasDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * LasEditor
 * -----------------------------------------------------------------------------
 * Entry point of the LAS core: load text into a {@link LasDocument}, edit its
 * curves, write it back out.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   loadDocument       → DefaultLasDocumentReader → CurveRowSynchronizer
 *   rename/delete/...  → CurveMutationEngine      → CurveRowSynchronizer
 *   serializeDocument  → DefaultLasDocumentWriter
 * </pre>
 *
 * <h2>Errors</h2>
 * Loading never fails on malformed content. Mutations throw
 * {@link com.questrail.las.api.CurveMutationException} and leave the document
 * unchanged.
 *
 * <h2>Threading</h2>
 * The editor itself holds no document state and may be shared. Documents are
 * not thread-safe; see {@link com.questrail.las.core.LasEditSession}.
 */
public final class LasEditor
{
    private final EditorConfig config;
    private final LasDocumentReader reader;
    private final LasDocumentWriter writer;
    private final CurveMutationEngine engine;

    public LasEditor() {
        this(EditorConfig.defaults());
    }

    public LasEditor(EditorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.reader = new DefaultLasDocumentReader(config.observabilitySink());
        this.writer = new DefaultLasDocumentWriter();
        this.engine = new CurveMutationEngine(config);
    }

    public EditorConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Text
    // -------------------------------------------------------------------------

    public LasDocument loadDocument(String text) {
        return reader.read(text);
    }

    public String serializeDocument(LasDocument document) {
        return writer.write(document, WriterOptions.defaults());
    }

    public String serializeDocument(LasDocument document, WriterOptions options) {
        return writer.write(document, options);
    }

    // -------------------------------------------------------------------------
    // Mutations
    // -------------------------------------------------------------------------

    public RenameOutcome renameCurve(LasDocument document, String oldMnemonic, String newMnemonic) {
        return engine.rename(document, oldMnemonic, newMnemonic);
    }

    public boolean deleteCurve(LasDocument document, String mnemonic) {
        return engine.delete(document, mnemonic);
    }

    /**
     * Deletes several curves; protected names are skipped rather than failing the batch.
     *
     * @return mnemonics actually deleted
     */
    public List<String> deleteCurves(LasDocument document, Collection<String> mnemonics) {
        return engine.deleteAll(document, mnemonics);
    }

    public DeriveOutcome deriveCurve(LasDocument document, String source, String destination,
                                     OperatorExpression expression) {
        return engine.derive(document, source, destination, expression);
    }

    /**
     * Parses {@code operatorText} (e.g. {@code "*2"}) and derives.
     */
    public DeriveOutcome deriveCurve(LasDocument document, String source, String destination, String operatorText) {
        return engine.derive(document, source, destination, OperatorExpression.parse(operatorText));
    }

    public PetrophysicalOutcome computePetrophysicalCurves(LasDocument document, PetrophysicalParameters params) {
        return engine.computePetrophysics(document, params);
    }

    public void applyEdit(LasDocument document, String mnemonic, CurveEdit edit) {
        engine.applyEdit(document, mnemonic, edit);
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public List<CurveSummary> curves(LasDocument document) {
        Objects.requireNonNull(document, "document");
        List<CurveSummary> out = new ArrayList<>(document.curveCount());
        for (Curve c : document.curves()) {
            out.add(new CurveSummary(c.mnemonic(), c.unit(), c.length()));
        }
        return out;
    }

    /**
     * Curves whose unit is one of {@code units}, ignoring case. See
     * {@link com.questrail.las.api.CurveUnits} for the usual sets.
     */
    public List<CurveSummary> curvesWithUnit(LasDocument document, Set<String> units) {
        Objects.requireNonNull(units, "units");
        List<CurveSummary> out = new ArrayList<>();
        for (CurveSummary s : curves(document)) {
            if (units.contains(s.unit().trim().toUpperCase(Locale.ROOT))) {
                out.add(s);
            }
        }
        return out;
    }
}
