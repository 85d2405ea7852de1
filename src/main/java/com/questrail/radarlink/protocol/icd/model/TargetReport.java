package com.questrail.radarlink.protocol.icd.model;

import java.util.List;
import java.util.Objects;

/**
 * Multi-target report.
 *
 * <p>
 * The sender declares a count and then appends that many 32-byte records.
 * When the payload holds fewer complete records than declared, the decoder
 * keeps what is there and the report is {@linkplain #truncated() truncated}.
 * </p>
 */
public record TargetReport(long declaredCount, List<Target> targets) implements RadarMessage
{
    public TargetReport {
        MessageHeader.requireU32(declaredCount, "declaredCount");
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        if (targets.size() > declaredCount) {
            throw new IllegalArgumentException(
                    "targets (" + targets.size() + ") exceed declared count " + declaredCount);
        }
    }

    /**
     * A complete report whose declared count matches its records.
     */
    public static TargetReport of(List<Target> targets) {
        return new TargetReport(targets.size(), targets);
    }

    /**
     * True when fewer records were present than the sender declared.
     */
    public boolean truncated() {
        return targets.size() < declaredCount;
    }
}
