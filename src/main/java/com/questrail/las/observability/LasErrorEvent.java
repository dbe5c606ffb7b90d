package com.questrail.las.observability;

import java.time.Instant;

/**
 * Record representing a rejected operation.
 */
public record LasErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
