package com.questrail.radarlink.protocol.icd.config;

/**
 * Mission settings copied into every system control request the C2 sends.
 * All values are u32 on the wire.
 */
public record ControlParameters(
        long missionCategory,
        long sensorControls,
        long radarControls,
        long frequencyIndex
) {
    private static final long U32_MAX = 0xFFFF_FFFFL;

    public ControlParameters {
        check(missionCategory, "missionCategory");
        check(sensorControls, "sensorControls");
        check(radarControls, "radarControls");
        check(frequencyIndex, "frequencyIndex");
    }

    /** All zero: default mission, no controls set, frequency index 0. */
    public static ControlParameters defaults() {
        return new ControlParameters(0, 0, 0, 0);
    }

    private static void check(long value, String name) {
        if (value < 0 || value > U32_MAX) {
            throw new IllegalArgumentException(name + " out of u32 range: " + value);
        }
    }
}
