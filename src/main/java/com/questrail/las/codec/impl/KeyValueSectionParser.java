package com.questrail.las.codec.impl;

import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;
import com.questrail.las.observability.LasParseSkipEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * KeyValueSectionParser
 * -----------------------------------------------------------------------------
 * Grammar of the {@code ~V}, {@code ~W} and {@code ~P} sections:
 *
 * <pre>
 *   MNEMONIC . UNIT  VALUE  : DESCRIPTION
 * </pre>
 *
 * <p>The unit is the token directly after the dot (it may be empty, and may
 * be separated from the dot by blanks); the value runs to the first colon;
 * the description is optional. Comment and blank lines are ignored; a line
 * that does not match is skipped and reported.</p>
 */
final class KeyValueSectionParser
{
    static final Pattern LINE =
            Pattern.compile("^\\s*([^.\\s]+)\\s*\\.\\s*([^ \\t:]*)\\s+([^:]*)?(?::\\s*(.*))?$");

    private KeyValueSectionParser() {}

    static List<ParameterRecord> parse(RawSection section, Consumer<LasParseSkipEvent> onSkip) {
        List<ParameterRecord> records = new ArrayList<>();
        List<String> lines = section.lines();

        for (int i = 0; i < lines.size(); i++) {
            final String raw = lines.get(i);
            final String line = LasLines.stripComment(raw).stripTrailing();
            if (line.isBlank()) {
                continue;
            }

            Optional<ParameterRecord> record = parseLine(line);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                onSkip.accept(new LasParseSkipEvent(
                        section.name(), section.firstLineNumber() + i, raw,
                        "not a MNEM.UNIT VALUE : DESCRIPTION line"));
            }
        }
        return records;
    }

    /**
     * Parses one comment-free line.
     */
    static Optional<ParameterRecord> parseLine(String line) {
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParameterRecord(
                m.group(1).trim(),
                trimmed(m.group(2)),
                trimmed(m.group(3)),
                trimmed(m.group(4))));
    }

    private static String trimmed(String s) {
        return s == null ? "" : s.trim();
    }
}
