package com.questrail.las.api;

/**
 * Result of a successful rename.
 */
public enum RenameOutcome
{
    /** The curve now carries the new mnemonic. */
    RENAMED,

    /** The new name equals the old one ignoring case; nothing changed. */
    UNCHANGED
}
