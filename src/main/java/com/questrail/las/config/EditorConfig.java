package com.questrail.las.config;

import com.questrail.las.mapping.MnemonicIndex;
import com.questrail.las.observability.LasObservabilitySink;
import com.questrail.las.observability.Slf4jLasObservabilitySink;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the editor core.
 *
 * @param protectedMnemonics curves that can never be renamed, deleted or
 *                           overwritten as a derive destination (stored case-folded)
 * @param sanitizeNames      when true, new mnemonics are upper-cased and
 *                           stripped to {@code [A-Z0-9_]} before use
 * @param observabilitySink  receiver of load, skip and mutation events
 */
public record EditorConfig(
    Set<String> protectedMnemonics,
    boolean sanitizeNames,
    LasObservabilitySink observabilitySink
) {
    /** Depth index curves, protected unless configured otherwise. */
    public static final Set<String> DEFAULT_PROTECTED = Set.of("DEPT", "DEPTH");

    public EditorConfig {
        Objects.requireNonNull(protectedMnemonics, "protectedMnemonics");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Set<String> folded = new LinkedHashSet<>();
        for (String m : protectedMnemonics) {
            folded.add(MnemonicIndex.fold(Objects.requireNonNull(m, "protected mnemonic")));
        }
        protectedMnemonics = Set.copyOf(folded);
    }

    public static EditorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True if {@code mnemonic} is protected, ignoring case.
     */
    public boolean isProtected(String mnemonic) {
        return protectedMnemonics.contains(MnemonicIndex.fold(mnemonic));
    }

    public static final class Builder {
        private final Set<String> protectedMnemonics = new LinkedHashSet<>(DEFAULT_PROTECTED);
        private boolean sanitizeNames = false;
        private LasObservabilitySink observabilitySink = new Slf4jLasObservabilitySink();

        public Builder withProtectedMnemonics(Collection<String> mnemonics) {
            protectedMnemonics.clear();
            protectedMnemonics.addAll(mnemonics);
            return this;
        }

        public Builder addProtectedMnemonic(String mnemonic) {
            protectedMnemonics.add(Objects.requireNonNull(mnemonic, "mnemonic"));
            return this;
        }

        public Builder withSanitizeNames(boolean sanitizeNames) {
            this.sanitizeNames = sanitizeNames;
            return this;
        }

        public Builder withObservabilitySink(LasObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public EditorConfig build() {
            return new EditorConfig(protectedMnemonics, sanitizeNames, observabilitySink);
        }
    }
}
