package com.questrail.las.api;

import java.util.Set;

/**
 * Units used to offer curves as inputs to the petrophysical derivation.
 */
public final class CurveUnits
{
    /** Bulk density curves. */
    public static final Set<String> DENSITY = Set.of("K/M3", "KG/M3");

    /** Gamma ray curves. */
    public static final Set<String> GAMMA = Set.of("GAPI");

    /** Resistivity curves. */
    public static final Set<String> RESISTIVITY = Set.of("OHMM");

    private CurveUnits() {}
}
