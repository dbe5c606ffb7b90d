package com.questrail.las.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Section names recognized by the reader and writer.
 *
 * <p>Files abbreviate headers to a single letter ({@code ~V}) or spell them
 * out ({@code ~VERSION INFORMATION}); only the first token counts, so both
 * forms land here under an alias.</p>
 */
public final class LasSections
{
    public static final String PRE = "PRE";

    public static final List<String> VERSION = List.of("V", "VERSION");
    public static final List<String> WELL = List.of("W", "WELL");
    public static final List<String> CURVE = List.of("C", "CURVE");
    public static final List<String> PARAMETER = List.of("P", "PARAMETER");
    public static final List<String> OTHER = List.of("O", "OTHER");
    public static final List<String> ASCII = List.of("A", "ASCII", "DATA");

    private static final List<List<String>> KNOWN =
            List.of(VERSION, WELL, CURVE, PARAMETER, OTHER, ASCII);

    private LasSections() {}

    /**
     * Returns the first section among {@code aliases} present in {@code sections}.
     */
    public static Optional<RawSection> find(Map<String, RawSection> sections, List<String> aliases) {
        for (String alias : aliases) {
            RawSection s = sections.get(alias);
            if (s != null) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * True if {@code name} is one of the standard sections (or the preamble).
     */
    public static boolean isKnown(String name) {
        if (PRE.equals(name)) {
            return true;
        }
        for (List<String> aliases : KNOWN) {
            if (aliases.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
