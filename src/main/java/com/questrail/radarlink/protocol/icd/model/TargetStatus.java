package com.questrail.radarlink.protocol.icd.model;

import java.util.Optional;

/**
 * Track lifecycle status carried in extended target data.
 */
public enum TargetStatus
{
    NEW(0),
    UPDATE(1),
    DELETE(2),
    EXTRAPOLATE(3);

    private final long code;

    TargetStatus(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static Optional<TargetStatus> fromCode(long code) {
        for (TargetStatus s : values()) {
            if (s.code == code) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
