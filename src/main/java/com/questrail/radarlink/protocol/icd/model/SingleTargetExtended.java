package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;

/**
 * Extended single-target report: one {@link TargetData} record (332 bytes)
 * followed by one {@link PlotData} record (176 bytes).
 */
public record SingleTargetExtended(TargetData target, PlotData plot) implements RadarMessage
{
    /** Encoded payload size. */
    public static final int SIZE = TargetData.SIZE + PlotData.SIZE;

    public SingleTargetExtended {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(plot, "plot");
    }
}
