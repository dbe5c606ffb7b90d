package com.questrail.las.codec.impl;

import com.questrail.las.model.LasSections;
import com.questrail.las.model.RawSection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LasSectionSplitter
 * -----------------------------------------------------------------------------
 * Partitions LAS text into raw sections.
 *
 * <p>A header is any line whose first non-blank character is {@code ~};
 * the section is named by the first word after it, upper-cased, so
 * {@code ~Curve Information} opens section {@code CURVE}. Section names are
 * not validated: unknown sections are kept for round trip.</p>
 *
 * <p>Lines before the first header, if any, form the synthetic
 * {@link LasSections#PRE} section.</p>
 */
final class LasSectionSplitter
{
    private static final Pattern HEADER = Pattern.compile("^\\s*~\\s*([A-Za-z0-9_]+)\\b(.*)$");

    private LasSectionSplitter() {}

    static List<RawSection> split(List<String> lines) {
        List<RawSection> sections = new ArrayList<>();

        String name = null;
        String header = "";
        int firstLine = 1;
        List<String> body = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i);
            final Matcher m = HEADER.matcher(line);

            if (m.matches()) {
                if (name != null) {
                    sections.add(new RawSection(name, header, body, firstLine));
                }
                name = m.group(1).toUpperCase(Locale.ROOT);
                header = line;
                firstLine = i + 2;
                body = new ArrayList<>();
                continue;
            }

            if (name == null) {
                name = LasSections.PRE;
                header = "";
                firstLine = i + 1;
            }
            body.add(line);
        }

        if (name != null) {
            sections.add(new RawSection(name, header, body, firstLine));
        }
        return sections;
    }
}
