package com.questrail.radarlink.protocol.icd.model;

import java.util.Optional;

/**
 * Operating mode reported in a system status message.
 */
public enum OperatingMode
{
    STANDBY(0, "Standby"),
    SEARCH(1, "Search"),
    TRACK(2, "Track"),
    SEARCH_AND_TRACK(3, "Search & Track"),
    MAINTENANCE(4, "Maintenance"),
    TEST(5, "Test");

    private final long code;
    private final String displayName;

    OperatingMode(long code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public long code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<OperatingMode> fromCode(long code) {
        for (OperatingMode m : values()) {
            if (m.code == code) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
