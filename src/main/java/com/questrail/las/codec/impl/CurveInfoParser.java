package com.questrail.las.codec.impl;

import com.questrail.las.model.Curve;
import com.questrail.las.model.RawSection;
import com.questrail.las.observability.LasParseSkipEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CurveInfoParser
 * -----------------------------------------------------------------------------
 * Grammar of the {@code ~C} section:
 *
 * <pre>
 *   MNEMONIC . UNIT   [API] [CODE ...]   : DESCRIPTION
 * </pre>
 *
 * <p>The tokens between the unit and the colon are split heuristically:
 * none gives an empty API code and free-form code; one is the API code;
 * with two or more, the first is the API code and the rest, joined by a
 * single blank, is the free-form code.</p>
 *
 * <p>Curves are produced in file order with empty data. A mnemonic defined
 * twice yields two curves.</p>
 */
final class CurveInfoParser
{
    private static final Pattern LINE =
            Pattern.compile("^\\s*([^.\\s]+)\\s*\\.\\s*([^ \\t:]*)\\s*(.*?)\\s*(?::\\s*(.*))?$");

    private CurveInfoParser() {}

    static List<Curve> parse(RawSection section, Consumer<LasParseSkipEvent> onSkip) {
        List<Curve> curves = new ArrayList<>();
        List<String> lines = section.lines();

        for (int i = 0; i < lines.size(); i++) {
            final String raw = lines.get(i);
            final String line = LasLines.stripComment(raw).stripTrailing();
            if (line.isBlank()) {
                continue;
            }

            Optional<Curve> curve = parseLine(line);
            if (curve.isPresent()) {
                curves.add(curve.get());
            } else {
                onSkip.accept(new LasParseSkipEvent(
                        section.name(), section.firstLineNumber() + i, raw,
                        "not a MNEM.UNIT API CODE : DESCRIPTION line"));
            }
        }
        return curves;
    }

    static Optional<Curve> parseLine(String line) {
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }

        final String mnemonic = m.group(1).trim();
        final String unit = trimmed(m.group(2));
        final String middle = trimmed(m.group(3));
        final String description = trimmed(m.group(4));

        String api = "";
        String code = "";
        if (!middle.isEmpty()) {
            String[] parts = middle.split("\\s+");
            api = parts[0];
            if (parts.length > 1) {
                code = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length));
            }
        }
        return Optional.of(new Curve(mnemonic, unit, api, code, description));
    }

    private static String trimmed(String s) {
        return s == null ? "" : s.trim();
    }
}
