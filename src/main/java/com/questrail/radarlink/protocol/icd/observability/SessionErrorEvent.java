package com.questrail.radarlink.protocol.icd.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the link stack.
 */
public record SessionErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
