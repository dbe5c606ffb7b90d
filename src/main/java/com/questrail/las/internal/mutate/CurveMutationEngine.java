package com.questrail.las.internal.mutate;

import com.questrail.las.api.CurveEdit;
import com.questrail.las.api.CurveMutationException;
import com.questrail.las.api.CurveMutationException.Reason;
import com.questrail.las.api.DeriveOutcome;
import com.questrail.las.api.OperatorExpression;
import com.questrail.las.api.PetrophysicalOutcome;
import com.questrail.las.api.PetrophysicalParameters;
import com.questrail.las.api.RenameOutcome;
import com.questrail.las.config.EditorConfig;
import com.questrail.las.internal.sync.CurveRowSynchronizer;
import com.questrail.las.mapping.MnemonicIndex;
import com.questrail.las.model.Curve;
import com.questrail.las.model.LasDocument;
import com.questrail.las.observability.LasErrorEvent;
import com.questrail.las.observability.LasMutationEvent;
import com.questrail.las.observability.LasObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * CurveMutationEngine
 * -----------------------------------------------------------------------------
 * Applies rename, delete, derive and edit operations to a {@link LasDocument}.
 *
 * <h2>Curve lifecycle</h2>
 * <pre>
 *   ABSENT --derive--> PRESENT --rename--> PRESENT --delete--> ABSENT
 *                         ^                   |
 *                         +--derive/edit------+   (data replaced, identity kept)
 * </pre>
 *
 * <h2>All or nothing</h2>
 * Every operation validates its inputs and computes its new data before the
 * first write to the document. A rejected operation throws
 * {@link CurveMutationException} and leaves the document as it was.
 *
 * <h2>After each mutation</h2>
 * The synchronizer runs, then a {@link LasMutationEvent} is emitted.
 * Rejections are reported as {@link LasErrorEvent} before the throw.
 *
 * <h2>Protected curves</h2>
 * Names in {@link EditorConfig#protectedMnemonics()} can be read as derive
 * sources but never renamed, deleted, edited or overwritten by a derive.
 * The petrophysical outputs are exempt from the overwrite rule.
 */
public final class CurveMutationEngine
{
    public static final String POROSITY_MNEMONIC = "DPHIX";
    public static final String SATURATION_MNEMONIC = "SWARCH";
    static final String PETRO_UNIT = "%";

    private final EditorConfig config;
    private final LasObservabilitySink sink;

    public CurveMutationEngine(EditorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
    }

    // -------------------------------------------------------------------------
    // Rename
    // -------------------------------------------------------------------------

    public RenameOutcome rename(LasDocument document, String oldMnemonic, String newMnemonic) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(oldMnemonic, "oldMnemonic");

        final int column = require(document, oldMnemonic);
        final String current = document.curveAt(column).mnemonic();
        if (config.isProtected(current)) {
            throw reject(Reason.PROTECTED, current, "Cannot rename protected curve: " + current);
        }

        final String target = resolveNewName(newMnemonic);
        if (MnemonicIndex.sameMnemonic(current, target)) {
            return RenameOutcome.UNCHANGED;
        }

        OptionalInt other = document.indexOf(target);
        if (other.isPresent() && other.getAsInt() != column) {
            throw reject(Reason.COLLISION, target, "A curve named " + target + " already exists");
        }

        document.renameCurveAt(column, target);
        CurveRowSynchronizer.reconcile(document);

        emit(LasMutationEvent.Kind.RENAMED, target, current + " -> " + target);
        return RenameOutcome.RENAMED;
    }

    // -------------------------------------------------------------------------
    // Delete
    // -------------------------------------------------------------------------

    /**
     * @return {@code false} if no curve is named {@code mnemonic}
     */
    public boolean delete(LasDocument document, String mnemonic) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(mnemonic, "mnemonic");
        final String name = mnemonic.trim();

        if (config.isProtected(name)) {
            throw reject(Reason.PROTECTED, name, "Cannot delete protected curve: " + name);
        }

        OptionalInt column = document.indexOf(name);
        if (column.isEmpty()) {
            return false;
        }

        Curve removed = document.removeColumnAt(column.getAsInt());
        CurveRowSynchronizer.reconcile(document);

        emit(LasMutationEvent.Kind.DELETED, removed.mnemonic(), "column " + column.getAsInt());
        return true;
    }

    /**
     * Deletes each named curve in order. Protected names are reported and
     * skipped; unknown names are ignored.
     *
     * @return mnemonics actually deleted, as they were spelled in the document
     */
    public List<String> deleteAll(LasDocument document, Collection<String> mnemonics) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(mnemonics, "mnemonics");

        List<String> deleted = new ArrayList<>();
        for (String requested : mnemonics) {
            String m = requested.trim();
            if (config.isProtected(m)) {
                sink.onError(new LasErrorEvent(Instant.now(), "Skipped protected curve: " + m, null));
                continue;
            }
            OptionalInt column = document.indexOf(m);
            if (column.isPresent()) {
                String spelled = document.curveAt(column.getAsInt()).mnemonic();
                if (delete(document, m)) {
                    deleted.add(spelled);
                }
            }
        }
        return deleted;
    }

    // -------------------------------------------------------------------------
    // Derive
    // -------------------------------------------------------------------------

    /**
     * Writes {@code source op k} into {@code destination}, creating it as the
     * last column if it does not exist.
     *
     * @param destination target mnemonic; {@code null} or blank means
     *                    {@code NEW_<source>}
     */
    public DeriveOutcome derive(LasDocument document, String source, String destination, OperatorExpression expression) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(expression, "expression");

        final Curve src = document.curveAt(require(document, source));
        final String target = (destination == null || destination.isBlank())
                ? Mnemonics.derivedName(src.mnemonic())
                : resolveNewName(destination);

        OptionalInt existing = document.indexOf(target);
        if (existing.isPresent() && config.isProtected(document.curveAt(existing.getAsInt()).mnemonic())) {
            throw reject(Reason.PROTECTED, target, "Cannot overwrite protected curve: " + target);
        }

        List<Double> data = new ArrayList<>(src.length());
        for (Double v : src.data()) {
            data.add((v == null || !Double.isFinite(v)) ? null : finiteOrNull(expression.apply(v)));
        }

        final String description = "Derived from " + src.mnemonic() + " by " + expression;
        final int column;
        final DeriveOutcome outcome;

        if (existing.isEmpty()) {
            Curve created = new Curve(target, src.unit(), src.apiCode(), src.freeformCode(), description);
            created.replaceData(data);
            document.addCurve(created);
            column = document.curveCount() - 1;
            outcome = DeriveOutcome.CREATED;
        } else {
            column = existing.getAsInt();
            Curve dst = document.curveAt(column);
            dst.replaceData(data);
            if (dst.unit().isBlank()) {
                dst.setUnit(src.unit());
            }
            dst.setDescription(description);
            outcome = DeriveOutcome.OVERWRITTEN;
        }

        CurveRowSynchronizer.reconcile(document);
        CurveRowSynchronizer.writeColumn(document, column);

        emit(outcome == DeriveOutcome.CREATED ? LasMutationEvent.Kind.CREATED : LasMutationEvent.Kind.OVERWRITTEN,
                document.curveAt(column).mnemonic(), description);
        return outcome;
    }

    // -------------------------------------------------------------------------
    // Petrophysics
    // -------------------------------------------------------------------------

    /**
     * Computes density porosity into {@code DPHIX} and Archie water
     * saturation into {@code SWARCH}, both in percent:
     *
     * <pre>
     *   dphi = 100 * (rho_ma - rho_b) / (rho_ma - rho_f)
     *   sw   = 100 * (Rw / (max(dphi/100, cutoff/100)^m * Rt))^(1/n)
     * </pre>
     *
     * Existing output curves are overwritten in place, so repeated runs
     * converge.
     *
     * <p>Note: {@code Rt} is read from the <b>density</b> curve, not from
     * {@link PetrophysicalParameters#resistivityMnemonic()}. The resistivity
     * curve must still exist.</p>
     */
    public PetrophysicalOutcome computePetrophysics(LasDocument document, PetrophysicalParameters params) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(params, "params");

        requireFinite("matrixDensity", params.matrixDensity());
        requireFinite("fluidDensity", params.fluidDensity());
        requireFinite("cementationExponent", params.cementationExponent());
        requireFinite("saturationExponent", params.saturationExponent());
        requireFinite("waterResistivity", params.waterResistivity());
        requireFinite("porosityCutoff", params.porosityCutoff());

        final Curve density = document.curveAt(require(document, params.densityMnemonic()));
        require(document, params.resistivityMnemonic());

        final double rhoMa = params.matrixDensity();
        final double rhoF = params.fluidDensity();
        final double m = params.cementationExponent();
        final double n = params.saturationExponent();
        final double rw = params.waterResistivity();
        final double cutoff = params.porosityCutoff() / 100.0;

        // TODO: read Rt from the resistivity curve
        final List<Double> rt = density.data();

        List<Double> porosity = new ArrayList<>(density.length());
        List<Double> saturation = new ArrayList<>(density.length());
        for (int i = 0; i < density.length(); i++) {
            Double v = density.data().get(i);
            if (v == null || !Double.isFinite(v)) {
                porosity.add(null);
                saturation.add(null);
                continue;
            }
            double dphi = 100.0 * (rhoMa - v) / (rhoMa - rhoF);
            double r = rt.get(i);
            double sw = 100.0 * Math.pow(rw / (Math.pow(Math.max(dphi / 100.0, cutoff), m) * r), 1.0 / n);
            porosity.add(finiteOrNull(dphi));
            saturation.add(finiteOrNull(sw));
        }

        DeriveOutcome phiOutcome = writeOutput(document, POROSITY_MNEMONIC, density,
                "Porosity from bulk density", porosity);
        DeriveOutcome swOutcome = writeOutput(document, SATURATION_MNEMONIC, density,
                "Water saturation (Archie)", saturation);

        return new PetrophysicalOutcome(phiOutcome, swOutcome);
    }

    private DeriveOutcome writeOutput(LasDocument document, String mnemonic, Curve template,
                                      String description, List<Double> data) {
        OptionalInt existing = document.indexOf(mnemonic);
        final int column;
        final DeriveOutcome outcome;

        if (existing.isEmpty()) {
            Curve created = new Curve(mnemonic, PETRO_UNIT, template.apiCode(), template.freeformCode(), description);
            created.replaceData(data);
            document.addCurve(created);
            column = document.curveCount() - 1;
            outcome = DeriveOutcome.CREATED;
        } else {
            column = existing.getAsInt();
            document.curveAt(column).replaceData(data);
            outcome = DeriveOutcome.OVERWRITTEN;
        }

        CurveRowSynchronizer.reconcile(document);
        CurveRowSynchronizer.writeColumn(document, column);

        emit(outcome == DeriveOutcome.CREATED ? LasMutationEvent.Kind.CREATED : LasMutationEvent.Kind.OVERWRITTEN,
                mnemonic, description);
        return outcome;
    }

    // -------------------------------------------------------------------------
    // Edit
    // -------------------------------------------------------------------------

    /**
     * Replaces each value of a curve with {@code edit.apply(value, row)}.
     * If {@code edit} throws, the curve is unchanged.
     */
    public void applyEdit(LasDocument document, String mnemonic, CurveEdit edit) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(mnemonic, "mnemonic");
        Objects.requireNonNull(edit, "edit");

        final int column = require(document, mnemonic);
        final Curve curve = document.curveAt(column);
        if (config.isProtected(curve.mnemonic())) {
            throw reject(Reason.PROTECTED, curve.mnemonic(), "Cannot edit protected curve: " + curve.mnemonic());
        }

        List<Double> data = new ArrayList<>(curve.length());
        for (int r = 0; r < curve.length(); r++) {
            data.add(finiteOrNull(edit.apply(curve.valueAt(r), r)));
        }

        curve.replaceData(data);
        CurveRowSynchronizer.reconcile(document);
        CurveRowSynchronizer.writeColumn(document, column);

        emit(LasMutationEvent.Kind.EDITED, curve.mnemonic(), data.size() + " values");
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private int require(LasDocument document, String mnemonic) {
        Objects.requireNonNull(mnemonic, "mnemonic");
        OptionalInt column = document.indexOf(mnemonic.trim());
        if (column.isEmpty()) {
            throw reject(Reason.NOT_FOUND, mnemonic, "Curve not found: " + mnemonic);
        }
        return column.getAsInt();
    }

    private String resolveNewName(String requested) {
        if (requested == null || requested.isBlank()) {
            throw reject(Reason.INVALID_NAME, requested, "Mnemonic must not be blank");
        }
        String name = config.sanitizeNames() ? Mnemonics.sanitize(requested) : requested.trim();
        if (!Mnemonics.isWritable(name)) {
            throw reject(Reason.INVALID_NAME, requested, "Invalid mnemonic: '" + requested + "'");
        }
        return name;
    }

    private void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw reject(Reason.INVALID_OPERAND, null, name + " must be finite: " + value);
        }
    }

    private static Double finiteOrNull(Double v) {
        return (v == null || !Double.isFinite(v)) ? null : v;
    }

    private CurveMutationException reject(Reason reason, String mnemonic, String message) {
        CurveMutationException ex = new CurveMutationException(reason, mnemonic, message);
        sink.onError(new LasErrorEvent(Instant.now(), message, ex));
        return ex;
    }

    private void emit(LasMutationEvent.Kind kind, String mnemonic, String detail) {
        sink.onMutation(new LasMutationEvent(Instant.now(), kind, mnemonic, detail));
    }
}
