package com.questrail.las.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Delimiter
 * -----------------------------------------------------------------------------
 * Column separator of the {@code ~A} numeric table.
 *
 * <p>The names match the values a file may declare under the {@code DLM}
 * mnemonic. On read, repeated separators collapse into one; {@link #SPACE}
 * additionally accepts any run of whitespace so that space-aligned tables
 * containing stray tabs still split correctly.</p>
 */
public enum Delimiter
{
    SPACE(' ', Pattern.compile("\\s+")),
    TAB('\t', Pattern.compile("\\t+")),
    COMMA(',', Pattern.compile(",+"));

    private final char separator;
    private final Pattern splitter;

    Delimiter(char separator, Pattern splitter) {
        this.separator = separator;
        this.splitter = splitter;
    }

    /**
     * Returns the single character written between cells on export.
     */
    public char separator() {
        return separator;
    }

    /**
     * Returns the pattern used to split a data line on read.
     */
    public Pattern splitter() {
        return splitter;
    }

    /**
     * Resolves a declared {@code DLM} value (case-insensitive, surrounding
     * whitespace ignored).
     *
     * @param text declared value, may be {@code null}
     * @return the delimiter, or empty if the text names none of the known ones
     */
    public static Optional<Delimiter> fromDeclared(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = text.trim().toUpperCase(Locale.ROOT);
        for (Delimiter d : values()) {
            if (d.name().equals(key)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
