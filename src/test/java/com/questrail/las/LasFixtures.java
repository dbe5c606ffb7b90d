package com.questrail.las;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test inputs shared across packages.
 */
public final class LasFixtures
{
    /** The three-line document used throughout the editor tests. */
    public static final String SMALL = String.join("\n",
            "~W",
            "NULL. -999.25 : Null",
            "~C",
            "DEPT.M : Depth",
            "GR.GAPI : Gamma",
            "~A",
            "100 -999.25",
            "200 55.2",
            "");

    private LasFixtures() {}

    /**
     * Reads a file from {@code src/test/resources/las}.
     */
    public static String resource(String name) {
        try (InputStream in = LasFixtures.class.getResourceAsStream("/las/" + name)) {
            if (in == null) {
                throw new IllegalStateException("missing test resource: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
