package com.questrail.las.core;

import com.questrail.las.LasEditor;
import com.questrail.las.api.CurveEdit;
import com.questrail.las.api.CurveSummary;
import com.questrail.las.api.DeriveOutcome;
import com.questrail.las.api.OperatorExpression;
import com.questrail.las.api.PetrophysicalOutcome;
import com.questrail.las.api.PetrophysicalParameters;
import com.questrail.las.api.RenameOutcome;
import com.questrail.las.config.WriterOptions;
import com.questrail.las.model.LasDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * LasEditSession
 * -----------------------------------------------------------------------------
 * One loaded document plus the editor that mutates it, safe to share between
 * threads.
 *
 * <h2>Threading model</h2>
 * A single private lock ("monitor") guards the document. Each mutation holds
 * it across the change and the synchronizer pass that follows, so no reader
 * ever observes curves and rows out of step. Queries return snapshots taken
 * under the same lock.
 *
 * <p>The document is never handed out; callers go through this class.</p>
 */
public final class LasEditSession
{
    private final Object lock = new Object();

    private final LasEditor editor;
    private final LasDocument document;

    private LasEditSession(LasEditor editor, LasDocument document) {
        this.editor = editor;
        this.document = document;
    }

    /**
     * Loads {@code text} with {@code editor} and opens a session over the result.
     */
    public static LasEditSession open(LasEditor editor, String text) {
        Objects.requireNonNull(editor, "editor");
        return new LasEditSession(editor, editor.loadDocument(text));
    }

    public RenameOutcome renameCurve(String oldMnemonic, String newMnemonic) {
        synchronized (lock) {
            return editor.renameCurve(document, oldMnemonic, newMnemonic);
        }
    }

    public boolean deleteCurve(String mnemonic) {
        synchronized (lock) {
            return editor.deleteCurve(document, mnemonic);
        }
    }

    public List<String> deleteCurves(Collection<String> mnemonics) {
        synchronized (lock) {
            return editor.deleteCurves(document, mnemonics);
        }
    }

    public DeriveOutcome deriveCurve(String source, String destination, OperatorExpression expression) {
        synchronized (lock) {
            return editor.deriveCurve(document, source, destination, expression);
        }
    }

    public PetrophysicalOutcome computePetrophysicalCurves(PetrophysicalParameters params) {
        synchronized (lock) {
            return editor.computePetrophysicalCurves(document, params);
        }
    }

    public void applyEdit(String mnemonic, CurveEdit edit) {
        synchronized (lock) {
            editor.applyEdit(document, mnemonic, edit);
        }
    }

    public List<CurveSummary> curves() {
        synchronized (lock) {
            return List.copyOf(editor.curves(document));
        }
    }

    /**
     * Snapshot of one curve's values.
     */
    public List<Double> curveData(String mnemonic) {
        synchronized (lock) {
            return document.curve(mnemonic)
                    .map(c -> Collections.unmodifiableList(new ArrayList<>(c.data())))
                    .orElse(List.of());
        }
    }

    public String serialize() {
        return serialize(WriterOptions.defaults());
    }

    public String serialize(WriterOptions options) {
        synchronized (lock) {
            return editor.serializeDocument(document, options);
        }
    }
}
