package com.questrail.radarlink.protocol.icd.observability;

import com.questrail.radarlink.protocol.icd.model.DecodeError;

import java.time.Instant;

/**
 * A decode or framing failure observed on the link.
 */
public record DecodeFailureEvent(
    Instant timestamp,
    DecodeError error
) {
}
