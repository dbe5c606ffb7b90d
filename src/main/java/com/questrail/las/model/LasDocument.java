package com.questrail.las.model;

import com.questrail.las.mapping.MnemonicIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * LasDocument
 * -----------------------------------------------------------------------------
 * In-memory form of one LAS file: header metadata, the raw text of every
 * section, the ordered curve list and the row-major data table.
 *
 * <h2>Ownership</h2>
 * A document is created once by a load, lives for the editing session and is
 * mutated in place. Neither the mutation engine nor the writer copies it.
 *
 * <h2>Invariants</h2>
 * After every load and every mutation:
 * <ul>
 *   <li>every row has exactly {@link #curveCount()} cells</li>
 *   <li>every curve's data has exactly {@link #rowCount()} values</li>
 *   <li>no cell equals the resolved null value; such cells are logical null</li>
 * </ul>
 * The document does not enforce these by itself. Structural changes made here
 * (adding, removing or renaming a curve) keep the mnemonic index current, and
 * {@link #removeColumnAt(int)} removes metadata and column together; the
 * synchronizer re-establishes the row/column agreement after everything else.
 *
 * <h2>Thread safety</h2>
 * None. See {@code LasEditSession} for a guarded wrapper.
 */
public final class LasDocument
{
    public static final String DEFAULT_VERSION = "2.0";

    private String version = DEFAULT_VERSION;
    private WrapMode wrapMode = WrapMode.ONE_LINE_PER_STEP;
    private Delimiter delimiter = Delimiter.SPACE;
    private Double nullValue;
    private String lineEnding = "\n";

    private final List<RawSection> sectionsInOrder = new ArrayList<>();
    private final Map<String, RawSection> sectionsByName = new LinkedHashMap<>();

    private final Map<String, ParameterRecord> versionParams = new LinkedHashMap<>();
    private final Map<String, ParameterRecord> wellParams = new LinkedHashMap<>();
    private final Map<String, ParameterRecord> parameterParams = new LinkedHashMap<>();

    private final List<Curve> curves = new ArrayList<>();
    private MnemonicIndex index = MnemonicIndex.of(List.of());

    private final List<DataRow> table = new ArrayList<>();

    // -------------------------------------------------------------------------
    // Header state
    // -------------------------------------------------------------------------

    public String version() {
        return version;
    }

    public void setVersion(String version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    public WrapMode wrapMode() {
        return wrapMode;
    }

    public void setWrapMode(WrapMode wrapMode) {
        this.wrapMode = Objects.requireNonNull(wrapMode, "wrapMode");
    }

    public Delimiter delimiter() {
        return delimiter;
    }

    public void setDelimiter(Delimiter delimiter) {
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
    }

    /**
     * The sentinel standing in for "no measurement", if the file declared one.
     */
    public OptionalDouble nullValue() {
        return nullValue == null ? OptionalDouble.empty() : OptionalDouble.of(nullValue);
    }

    /**
     * Sets or clears ({@code null}) the sentinel used on export.
     */
    public void setNullValue(Double nullValue) {
        if (nullValue != null && !Double.isFinite(nullValue)) {
            throw new IllegalArgumentException("null value must be finite: " + nullValue);
        }
        this.nullValue = nullValue;
    }

    /**
     * Line ending detected in the loaded text ({@code "\r\n"}, {@code "\r"} or {@code "\n"}).
     */
    public String lineEnding() {
        return lineEnding;
    }

    public void setLineEnding(String lineEnding) {
        this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
    }

    // -------------------------------------------------------------------------
    // Raw sections
    // -------------------------------------------------------------------------

    /**
     * Records a section as read. If the name repeats, the later occurrence
     * replaces the earlier one for lookup; both stay in {@link #sections()}.
     */
    public void addRawSection(RawSection section) {
        Objects.requireNonNull(section, "section");
        sectionsInOrder.add(section);
        sectionsByName.put(section.name(), section);
    }

    /**
     * Every section in source order, including the preamble and repeats.
     */
    public List<RawSection> sections() {
        return Collections.unmodifiableList(sectionsInOrder);
    }

    /**
     * Section lookup by upper-cased name.
     */
    public Map<String, RawSection> rawSections() {
        return Collections.unmodifiableMap(sectionsByName);
    }

    public Optional<RawSection> section(List<String> aliases) {
        return LasSections.find(sectionsByName, aliases);
    }

    // -------------------------------------------------------------------------
    // Key-value sections
    // -------------------------------------------------------------------------

    public Map<String, ParameterRecord> versionParams() {
        return Collections.unmodifiableMap(versionParams);
    }

    public Map<String, ParameterRecord> wellParams() {
        return Collections.unmodifiableMap(wellParams);
    }

    public Map<String, ParameterRecord> parameterParams() {
        return Collections.unmodifiableMap(parameterParams);
    }

    public Optional<ParameterRecord> versionParam(String mnemonic) {
        return Optional.ofNullable(versionParams.get(MnemonicIndex.fold(mnemonic)));
    }

    public Optional<ParameterRecord> wellParam(String mnemonic) {
        return Optional.ofNullable(wellParams.get(MnemonicIndex.fold(mnemonic)));
    }

    public Optional<ParameterRecord> parameterParam(String mnemonic) {
        return Optional.ofNullable(parameterParams.get(MnemonicIndex.fold(mnemonic)));
    }

    public void putVersionParam(ParameterRecord record) {
        versionParams.put(MnemonicIndex.fold(record.mnemonic()), record);
    }

    public void putWellParam(ParameterRecord record) {
        wellParams.put(MnemonicIndex.fold(record.mnemonic()), record);
    }

    public void putParameterParam(ParameterRecord record) {
        parameterParams.put(MnemonicIndex.fold(record.mnemonic()), record);
    }

    // -------------------------------------------------------------------------
    // Curves
    // -------------------------------------------------------------------------

    /**
     * Read-only view of the curves in column order.
     */
    public List<Curve> curves() {
        return Collections.unmodifiableList(curves);
    }

    public int curveCount() {
        return curves.size();
    }

    public Curve curveAt(int column) {
        return curves.get(column);
    }

    /**
     * Column of the first curve named {@code mnemonic}, ignoring case.
     */
    public OptionalInt indexOf(String mnemonic) {
        return index.find(mnemonic);
    }

    public Optional<Curve> curve(String mnemonic) {
        OptionalInt idx = index.find(mnemonic);
        return idx.isPresent() ? Optional.of(curves.get(idx.getAsInt())) : Optional.empty();
    }

    /**
     * Appends a curve as the last column. Rows are not widened here.
     */
    public void addCurve(Curve curve) {
        curves.add(Objects.requireNonNull(curve, "curve"));
        reindex();
    }

    /**
     * Removes the curve at {@code column} and the same cell from every row.
     */
    public Curve removeColumnAt(int column) {
        Objects.checkIndex(column, curves.size());
        for (DataRow row : table) {
            if (column < row.size()) {
                row.removeColumn(column);
            }
        }
        Curve removed = curves.remove(column);
        reindex();
        return removed;
    }

    public void renameCurveAt(int column, String newMnemonic) {
        curves.get(column).rename(newMnemonic);
        reindex();
    }

    private void reindex() {
        List<String> names = new ArrayList<>(curves.size());
        for (Curve c : curves) {
            names.add(c.mnemonic());
        }
        index = MnemonicIndex.of(names);
    }

    // -------------------------------------------------------------------------
    // Table
    // -------------------------------------------------------------------------

    /**
     * Read-only view of the rows; the rows themselves are live.
     */
    public List<DataRow> rows() {
        return Collections.unmodifiableList(table);
    }

    public int rowCount() {
        return table.size();
    }

    public DataRow rowAt(int row) {
        return table.get(row);
    }

    /**
     * Replaces the whole table (used by the reader).
     */
    public void replaceTable(List<DataRow> rows) {
        Objects.requireNonNull(rows, "rows");
        table.clear();
        table.addAll(rows);
    }

    /**
     * Drops trailing rows or appends rows of {@code width} absent cells.
     */
    public void resizeTable(int rowCount, int width) {
        while (table.size() > rowCount) {
            table.remove(table.size() - 1);
        }
        while (table.size() < rowCount) {
            table.add(DataRow.absent(width));
        }
    }

    @Override
    public String toString() {
        return "LasDocument[version=" + version
                + ", delimiter=" + delimiter
                + ", nullValue=" + nullValue
                + ", curves=" + curves.size()
                + ", rows=" + table.size() + ']';
    }
}
