package com.questrail.radarlink.protocol.icd.observability;

import com.questrail.radarlink.protocol.icd.model.DecodedMessage;

import java.time.Instant;

/**
 * A message that decoded, but whose declared length disagreed with the bytes
 * received.
 */
public record HeaderWarningEvent(
    Instant timestamp,
    DecodedMessage message
) {
}
