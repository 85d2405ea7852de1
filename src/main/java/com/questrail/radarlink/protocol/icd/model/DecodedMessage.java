package com.questrail.radarlink.protocol.icd.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A successfully decoded message: header, body and any length warnings.
 */
public record DecodedMessage(MessageHeader header, RadarMessage body, Set<HeaderWarning> warnings)
{
    public DecodedMessage {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(warnings, "warnings");
        warnings = warnings.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
    }

    public DecodedMessage(MessageHeader header, RadarMessage body) {
        this(header, body, Set.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
