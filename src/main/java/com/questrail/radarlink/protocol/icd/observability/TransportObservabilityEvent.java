package com.questrail.radarlink.protocol.icd.observability;

import java.time.Instant;

/**
 * Channel lifecycle change as seen by the transport adapter.
 *
 * @param cause failure that closed the channel, or {@code null} for an orderly
 *              close or for {@link Kind#UP}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String description,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN
    }
}
