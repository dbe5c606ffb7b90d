package com.questrail.las.codec.impl;

import com.questrail.las.model.DataRow;
import com.questrail.las.model.Delimiter;
import com.questrail.las.model.RawSection;
import com.questrail.las.model.WrapMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AsciiDataParser
 * -----------------------------------------------------------------------------
 * Reads the {@code ~A} section into rows of numbers.
 *
 * <p>Each non-empty, comment-free line is trimmed and split on runs of the
 * delimiter. A token is read as the longest leading decimal number it
 * starts with ({@code 12.5abc} reads as 12.5); a token with no such prefix
 * becomes logical null.</p>
 *
 * <p>In {@link WrapMode#WRAPPED} layout, lines are joined until a row
 * holds one value per declared curve. A trailing partial row is kept.</p>
 *
 * <p>Sentinel replacement is a separate pass ({@link #replaceSentinel})
 * because the null value is resolved after the table is read.</p>
 */
final class AsciiDataParser
{
    private static final Pattern NUMBER_PREFIX =
            Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private AsciiDataParser() {}

    static List<List<Double>> parse(RawSection section, Delimiter delimiter, WrapMode wrapMode, int curveCount) {
        List<List<Double>> rows = new ArrayList<>();
        boolean wrapped = wrapMode == WrapMode.WRAPPED && curveCount > 0;
        List<Double> pending = new ArrayList<>();

        for (String raw : section.lines()) {
            String line = LasLines.stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }

            List<Double> values = new ArrayList<>();
            for (String token : delimiter.splitter().split(line)) {
                String t = token.trim();
                if (!t.isEmpty()) {
                    values.add(parseLenient(t));
                }
            }
            if (values.isEmpty()) {
                continue;
            }

            if (!wrapped) {
                rows.add(values);
                continue;
            }

            pending.addAll(values);
            while (pending.size() >= curveCount) {
                rows.add(new ArrayList<>(pending.subList(0, curveCount)));
                pending = new ArrayList<>(pending.subList(curveCount, pending.size()));
            }
        }

        if (!pending.isEmpty()) {
            rows.add(pending);
        }
        return rows;
    }

    /**
     * Replaces cells exactly equal to {@code nullValue} with logical null.
     */
    static void replaceSentinel(List<List<Double>> rows, Double nullValue) {
        if (nullValue == null) {
            return;
        }
        for (List<Double> row : rows) {
            for (int c = 0; c < row.size(); c++) {
                Double v = row.get(c);
                if (v != null && v.doubleValue() == nullValue.doubleValue()) {
                    row.set(c, null);
                }
            }
        }
    }

    static List<DataRow> toDataRows(List<List<Double>> rows) {
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<DataRow> out = new ArrayList<>(rows.size());
        for (List<Double> row : rows) {
            out.add(DataRow.of(row));
        }
        return out;
    }

    /**
     * Parses the leading number of {@code token}; {@code null} if there is
     * none or it is not finite.
     */
    static Double parseLenient(String token) {
        if (token == null) {
            return null;
        }
        Matcher m = NUMBER_PREFIX.matcher(token.trim());
        if (!m.find()) {
            return null;
        }
        double v = Double.parseDouble(m.group());
        return Double.isFinite(v) ? v : null;
    }
}
