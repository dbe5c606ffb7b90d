package com.questrail.las.codec.impl;

import com.questrail.las.codec.LasDocumentWriter;
import com.questrail.las.codec.LasNumberFormat;
import com.questrail.las.config.WriterOptions;
import com.questrail.las.internal.sync.CurveRowSynchronizer;
import com.questrail.las.mapping.MnemonicIndex;
import com.questrail.las.model.Curve;
import com.questrail.las.model.Delimiter;
import com.questrail.las.model.LasDocument;
import com.questrail.las.model.LasSections;
import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;
import com.questrail.las.model.WrapMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;

/**
 * Default implementation of {@link LasDocumentWriter}.
 *
 * <h2>Layout</h2>
 * <pre>
 *   [preamble]        verbatim, only if it has content
 *   ~V                raw lines, VERS / WRAP / DLM brought up to date
 *   ~W                raw lines, NULL / declared DLM brought up to date
 *   ~Curve Information regenerated from the curve list
 *   ~P                raw lines
 *   ~O                raw lines
 *   [other sections]  verbatim, in source order
 *   ~ASCII            regenerated from curve data
 * </pre>
 *
 * <p>Data is always written one line per depth step, so {@code WRAP} is
 * always written as {@code NO}.</p>
 */
public final class DefaultLasDocumentWriter implements LasDocumentWriter
{
    static final String CURVE_HEADER = "~Curve Information";
    static final String CURVE_COLUMNS = "#MNEM.UNIT         API CODE           : CURVE DESCRIPTION";
    static final String ASCII_HEADER = "~ASCII";

    @Override
    public String write(LasDocument document, WriterOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");

        final Delimiter delimiter = options.delimiterFor(document);
        final List<String> out = new ArrayList<>();

        document.section(List.of(LasSections.PRE)).ifPresent(pre -> {
            if (pre.lines().stream().anyMatch(l -> !l.isBlank())) {
                out.addAll(pre.lines());
            }
        });

        writeVersion(document, delimiter, out);
        writeWell(document, delimiter, out);

        out.add(CURVE_HEADER);
        out.add(CURVE_COLUMNS);
        for (Curve c : document.curves()) {
            out.add(formatCurveLine(c));
        }

        document.section(LasSections.PARAMETER).ifPresent(s -> {
            out.add(headerOr(s, "~Parameter"));
            out.addAll(s.lines());
        });
        document.section(LasSections.OTHER).ifPresent(s -> {
            out.add(headerOr(s, "~Other"));
            out.addAll(s.lines());
        });

        for (RawSection s : document.sections()) {
            if (!LasSections.isKnown(s.name())) {
                out.add(s.headerLine());
                out.addAll(s.lines());
            }
        }

        out.add(ASCII_HEADER);
        final OptionalDouble nullValue = document.nullValue();
        final String separator = String.valueOf(delimiter.separator());
        for (List<Double> row : CurveRowSynchronizer.rowsFromCurves(document)) {
            List<String> cells = new ArrayList<>(row.size());
            for (Double v : row) {
                cells.add(LasNumberFormat.cell(v, nullValue, options.precision()));
            }
            out.add(String.join(separator, cells).stripTrailing());
        }

        final String eol = options.lineEndingFor(document);
        return String.join(eol, out) + eol;
    }

    // -------------------------------------------------------------------------
    // Key-value sections
    // -------------------------------------------------------------------------

    private static void writeVersion(LasDocument document, Delimiter delimiter, List<String> out) {
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put("VERS", document.version());
        updates.put("WRAP", WrapMode.ONE_LINE_PER_STEP.declared());
        if (delimiter != Delimiter.SPACE || document.versionParam("DLM").isPresent()) {
            updates.put("DLM", delimiter.name());
        }

        Optional<RawSection> section = document.section(LasSections.VERSION);
        if (section.isPresent()) {
            out.add(headerOr(section.get(), "~Version"));
            out.addAll(rebuildKeyValueLines(section.get(), updates));
        } else {
            out.add("~Version");
            for (Map.Entry<String, String> e : updates.entrySet()) {
                out.add(appendedLine(e.getKey(), e.getValue()));
            }
        }
    }

    private static void writeWell(LasDocument document, Delimiter delimiter, List<String> out) {
        Map<String, String> updates = new LinkedHashMap<>();
        document.nullValue().ifPresent(v -> updates.put("NULL", LasNumberFormat.plain(v)));
        // a declared ~W DLM must name the delimiter the rows are written with
        if (document.wellParam("DLM").isPresent()) {
            updates.put("DLM", delimiter.name());
        }

        Optional<RawSection> section = document.section(LasSections.WELL);
        if (section.isPresent()) {
            out.add(headerOr(section.get(), "~Well"));
            out.addAll(rebuildKeyValueLines(section.get(), updates));
        } else {
            out.add("~Well");
            for (Map.Entry<String, String> e : updates.entrySet()) {
                out.add(appendedLine(e.getKey(), e.getValue()));
            }
        }
    }

    /**
     * Copies raw lines, rewriting the line of each updated mnemonic whose
     * value has changed and appending updated mnemonics the section lacks.
     */
    static List<String> rebuildKeyValueLines(RawSection section, Map<String, String> updates) {
        List<String> lines = new ArrayList<>(section.lines().size() + updates.size());
        Map<String, String> missing = new LinkedHashMap<>(updates);

        for (String raw : section.lines()) {
            String line = LasLines.stripComment(raw).stripTrailing();
            Matcher m = KeyValueSectionParser.LINE.matcher(line);
            if (line.isBlank() || !m.matches()) {
                lines.add(raw);
                continue;
            }

            String key = MnemonicIndex.fold(m.group(1).trim());
            String newValue = missing.remove(key);
            if (newValue == null) {
                lines.add(raw);
                continue;
            }

            ParameterRecord record = KeyValueSectionParser.parseLine(line).orElseThrow();
            if (sameValue(key, record.effectiveValue(), newValue)) {
                lines.add(raw);
                continue;
            }

            String unit = record.valueInUnitSlot() ? "" : record.unit();
            lines.add((key + "." + unit + "  " + newValue + " : " + record.description()).stripTrailing());
        }

        for (Map.Entry<String, String> e : missing.entrySet()) {
            lines.add(appendedLine(e.getKey(), e.getValue()));
        }
        return lines;
    }

    private static boolean sameValue(String key, String current, String updated) {
        if ("NULL".equals(key)) {
            Double a = AsciiDataParser.parseLenient(current);
            Double b = AsciiDataParser.parseLenient(updated);
            return a != null && a.equals(b);
        }
        return current.trim().equalsIgnoreCase(updated.trim());
    }

    private static String appendedLine(String key, String value) {
        return (key + ".  " + value + " : " + defaultDescription(key)).stripTrailing();
    }

    private static String defaultDescription(String key) {
        return switch (key) {
            case "VERS" -> "LAS version";
            case "WRAP" -> "One line per depth step";
            case "DLM" -> "Delimiter";
            case "NULL" -> "Null value";
            default -> "";
        };
    }

    private static String headerOr(RawSection section, String fallback) {
        return section.headerLine().isBlank() ? fallback : section.headerLine();
    }

    // -------------------------------------------------------------------------
    // Curve section
    // -------------------------------------------------------------------------

    /**
     * {@code MNEM    .UNIT     API              CODE             : DESCRIPTION},
     * with the blank run before the colon collapsed to one space.
     */
    static String formatCurveLine(Curve c) {
        String line = pad(c.mnemonic(), 8) + "." + pad(c.unit(), 8) + " "
                + pad(c.apiCode(), 16) + " " + pad(c.freeformCode(), 16) + " : " + c.description();
        return line.replaceFirst("\\s+:", " :");
    }

    private static String pad(String s, int width) {
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
