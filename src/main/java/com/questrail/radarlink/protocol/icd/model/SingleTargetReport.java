package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;

/**
 * Report carrying exactly one 32-byte {@link Target} record.
 */
public record SingleTargetReport(Target target) implements RadarMessage
{
    public SingleTargetReport {
        Objects.requireNonNull(target, "target");
    }
}
