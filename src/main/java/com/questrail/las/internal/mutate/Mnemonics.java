package com.questrail.las.internal.mutate;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rules for mnemonics chosen by a user rather than read from a file.
 */
public final class Mnemonics
{
    /** Prefix of the destination name used when a derive names none. */
    public static final String DERIVED_PREFIX = "NEW_";

    // Characters that would change how the ~C line parses, or open a section.
    private static final Pattern UNSAFE = Pattern.compile("[\\s.:#~]");

    private Mnemonics() {}

    /**
     * Upper-cases, turns whitespace runs into {@code _} and drops anything
     * outside {@code [A-Z0-9_]}. May return an empty string.
     */
    public static String sanitize(String name) {
        return name.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Z0-9_]", "");
    }

    /**
     * True if {@code name} can be written as a {@code ~C} mnemonic and read back unchanged.
     */
    public static boolean isWritable(String name) {
        return !name.isEmpty() && !UNSAFE.matcher(name).find();
    }

    public static String derivedName(String sourceMnemonic) {
        return DERIVED_PREFIX + sourceMnemonic;
    }
}
