package com.questrail.las.api;

import java.util.Objects;

/**
 * Inputs of the density-porosity / Archie water-saturation derivation.
 *
 * <p>All scalars are passed explicitly by the caller; the core never reads
 * them from anywhere else.</p>
 *
 * @param densityMnemonic     bulk density curve
 * @param resistivityMnemonic resistivity curve (see the note on the derivation
 *                            about which column is actually read)
 * @param matrixDensity       rho_ma, same unit as the density curve
 * @param fluidDensity        rho_f, same unit as the density curve
 * @param cementationExponent Archie m
 * @param saturationExponent  Archie n
 * @param waterResistivity    Rw, ohm-m
 * @param porosityCutoff      lower bound applied to porosity inside the
 *                            saturation formula, in percent
 */
public record PetrophysicalParameters(
        String densityMnemonic,
        String resistivityMnemonic,
        double matrixDensity,
        double fluidDensity,
        double cementationExponent,
        double saturationExponent,
        double waterResistivity,
        double porosityCutoff
) {
    public PetrophysicalParameters {
        Objects.requireNonNull(densityMnemonic, "densityMnemonic");
        Objects.requireNonNull(resistivityMnemonic, "resistivityMnemonic");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String densityMnemonic;
        private String resistivityMnemonic;
        private double matrixDensity = 2650.0;
        private double fluidDensity = 1000.0;
        private double cementationExponent = 2.0;
        private double saturationExponent = 2.0;
        private double waterResistivity = 0.05;
        private double porosityCutoff = 0.0;

        private Builder() {}

        public Builder withDensity(String mnemonic) {
            this.densityMnemonic = mnemonic;
            return this;
        }

        public Builder withResistivity(String mnemonic) {
            this.resistivityMnemonic = mnemonic;
            return this;
        }

        public Builder withMatrixDensity(double matrixDensity) {
            this.matrixDensity = matrixDensity;
            return this;
        }

        public Builder withFluidDensity(double fluidDensity) {
            this.fluidDensity = fluidDensity;
            return this;
        }

        public Builder withCementationExponent(double m) {
            this.cementationExponent = m;
            return this;
        }

        public Builder withSaturationExponent(double n) {
            this.saturationExponent = n;
            return this;
        }

        public Builder withWaterResistivity(double rw) {
            this.waterResistivity = rw;
            return this;
        }

        public Builder withPorosityCutoff(double cutoffPercent) {
            this.porosityCutoff = cutoffPercent;
            return this;
        }

        public PetrophysicalParameters build() {
            return new PetrophysicalParameters(
                    densityMnemonic, resistivityMnemonic,
                    matrixDensity, fluidDensity,
                    cementationExponent, saturationExponent,
                    waterResistivity, porosityCutoff);
        }
    }
}
