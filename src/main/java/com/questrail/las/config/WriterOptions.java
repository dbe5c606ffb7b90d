package com.questrail.las.config;

import com.questrail.las.model.Delimiter;
import com.questrail.las.model.LasDocument;

import java.util.Objects;

/**
 * Export settings. Every field left unset falls back to the document.
 *
 * @param delimiter  table delimiter; {@code null} uses {@link LasDocument#delimiter()}
 * @param precision  fraction digits for table values; {@code null} writes the plain form
 * @param lineEnding line terminator; {@code null} uses {@link LasDocument#lineEnding()}
 */
public record WriterOptions(
    Delimiter delimiter,
    Integer precision,
    String lineEnding
) {
    private static final WriterOptions DEFAULTS = new WriterOptions(null, null, null);

    public WriterOptions {
        if (precision != null && precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0: " + precision);
        }
        if (lineEnding != null && lineEnding.isEmpty()) {
            throw new IllegalArgumentException("lineEnding must not be empty");
        }
    }

    public static WriterOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Delimiter delimiterFor(LasDocument document) {
        return delimiter != null ? delimiter : document.delimiter();
    }

    public String lineEndingFor(LasDocument document) {
        return lineEnding != null ? lineEnding : document.lineEnding();
    }

    public static final class Builder {
        private Delimiter delimiter;
        private Integer precision;
        private String lineEnding;

        public Builder withDelimiter(Delimiter delimiter) {
            this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
            return this;
        }

        public Builder withPrecision(int precision) {
            this.precision = precision;
            return this;
        }

        public Builder withLineEnding(String lineEnding) {
            this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
            return this;
        }

        public WriterOptions build() {
            return new WriterOptions(delimiter, precision, lineEnding);
        }
    }
}
