package com.questrail.las.model;

import java.util.Locale;

/**
 * Layout of the {@code ~A} section as declared by the {@code WRAP} mnemonic.
 */
public enum WrapMode
{
    /** {@code WRAP. NO} - every depth step occupies exactly one line. */
    ONE_LINE_PER_STEP("NO"),

    /** {@code WRAP. YES} - a depth step may continue over several lines. */
    WRAPPED("YES");

    private final String declared;

    WrapMode(String declared) {
        this.declared = declared;
    }

    /**
     * Returns the value written under {@code WRAP}.
     */
    public String declared() {
        return declared;
    }

    /**
     * Only {@code YES} (any case) selects {@link #WRAPPED}; everything else,
     * including a missing value, is one line per step.
     */
    public static WrapMode fromDeclared(String text) {
        if (text != null && text.trim().toUpperCase(Locale.ROOT).equals("YES")) {
            return WRAPPED;
        }
        return ONE_LINE_PER_STEP;
    }
}
