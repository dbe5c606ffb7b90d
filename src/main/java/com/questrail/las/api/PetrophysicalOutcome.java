package com.questrail.las.api;

import java.util.Objects;

/**
 * Result of the density-porosity / Archie-saturation derivation.
 *
 * @param porosity        outcome for the porosity curve
 * @param waterSaturation outcome for the water-saturation curve
 */
public record PetrophysicalOutcome(
        DeriveOutcome porosity,
        DeriveOutcome waterSaturation
) {
    public PetrophysicalOutcome {
        Objects.requireNonNull(porosity, "porosity");
        Objects.requireNonNull(waterSaturation, "waterSaturation");
    }
}
