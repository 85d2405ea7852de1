package com.questrail.radarlink.protocol.icd.model;

/**
 * System control command (C2 to radar controller).
 *
 * <p>
 * Carries the requested radar state plus the mission, sensor and frequency
 * settings that accompany it. Where each field sits in the payload, and how
 * long the payload is, depends on the protocol revision in use; this record
 * only holds the values.
 * </p>
 *
 * @param radarState      requested radar state control code
 * @param missionCategory mission category
 * @param sensorControls  HFL sensor control bits, one byte per control
 * @param radarControls   radar control bits, one byte per control
 * @param frequencyIndex  operating frequency index
 */
public record SystemControl(
        long radarState,
        long missionCategory,
        long sensorControls,
        long radarControls,
        long frequencyIndex
) implements RadarMessage
{
    public SystemControl {
        MessageHeader.requireU32(radarState, "radarState");
        MessageHeader.requireU32(missionCategory, "missionCategory");
        MessageHeader.requireU32(sensorControls, "sensorControls");
        MessageHeader.requireU32(radarControls, "radarControls");
        MessageHeader.requireU32(frequencyIndex, "frequencyIndex");
    }
}
