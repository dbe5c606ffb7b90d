package com.questrail.las.observability;

import java.time.Instant;

/**
 * Record of a mutation applied to a document.
 */
public record LasMutationEvent(
    Instant timestamp,
    Kind kind,
    String mnemonic,
    String detail
) {
    public enum Kind {
        RENAMED,
        DELETED,
        CREATED,
        OVERWRITTEN,
        EDITED
    }
}
