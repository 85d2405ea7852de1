package com.questrail.radarlink.protocol.icd.model;

import java.util.Optional;

/**
 * Target classification codes used by target reports.
 */
public enum TargetClass
{
    UNKNOWN(0),
    AIRCRAFT(1),
    HELICOPTER(2),
    BIRD(3),
    CLUTTER(4),
    WEATHER(5);

    private final long code;

    TargetClass(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static Optional<TargetClass> fromCode(long code) {
        for (TargetClass c : values()) {
            if (c.code == code) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
