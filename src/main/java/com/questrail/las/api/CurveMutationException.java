package com.questrail.las.api;

import java.util.Objects;

/**
 * Indicates that a curve mutation was rejected.
 *
 * <p>A mutation that throws this has not touched the document: every check
 * runs before the first field is written.</p>
 */
public final class CurveMutationException extends RuntimeException
{
    /**
     * Why a mutation was rejected.
     */
    public enum Reason {
        /** The referenced mnemonic is not in the document. */
        NOT_FOUND,

        /** The target is in the protected set. */
        PROTECTED,

        /** The new name is already used by a different curve. */
        COLLISION,

        /** Malformed operator expression, zero divisor or non-finite parameter. */
        INVALID_OPERAND,

        /** The requested mnemonic is blank or sanitizes to nothing. */
        INVALID_NAME
    }

    private final Reason reason;
    private final String mnemonic;

    public CurveMutationException(Reason reason, String mnemonic, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.mnemonic = mnemonic;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The mnemonic the failure refers to, or {@code null} if none applies.
     */
    public String mnemonic() {
        return mnemonic;
    }

    static CurveMutationException invalidOperand(String message) {
        return new CurveMutationException(Reason.INVALID_OPERAND, null, message);
    }
}
