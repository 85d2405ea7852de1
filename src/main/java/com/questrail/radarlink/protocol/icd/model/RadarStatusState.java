package com.questrail.radarlink.protocol.icd.model;

import java.util.Optional;

/**
 * Radar state as reported in a system status message.
 *
 * <p>These are <em>status</em> codes. They are a different code space from the
 * control codes a C2 sends in {@link SystemControl}.</p>
 */
public enum RadarStatusState
{
    IDLE(0),
    STARTUP(1),
    OPERATIONAL(2),
    STANDBY(3),
    ERROR(4),
    MAINTENANCE(5);

    private final long code;

    RadarStatusState(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static Optional<RadarStatusState> fromCode(long code) {
        for (RadarStatusState s : values()) {
            if (s.code == code) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
