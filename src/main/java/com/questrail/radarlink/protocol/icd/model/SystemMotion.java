package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;

/**
 * Platform motion report.
 *
 * <p>
 * Angular quantities are radians on the wire. The {@code ...Degrees()}
 * helpers present them the way operators read them.
 * </p>
 *
 * @param timeTag         sender time tag (u64)
 * @param platformId      platform identifier
 * @param validity        validity bitmask for the blocks below
 * @param position        latitude (rad), longitude (rad), altitude (m)
 * @param attitude        roll, pitch, yaw (rad)
 * @param velocity        north, east, down (m/s)
 * @param angularVelocity roll, pitch, yaw rates (rad/s)
 * @param acceleration    north, east, down (m/s^2)
 */
public record SystemMotion(
        long timeTag,
        long platformId,
        long validity,
        Vector3 position,
        Vector3 attitude,
        Vector3 velocity,
        Vector3 angularVelocity,
        Vector3 acceleration
) implements RadarMessage
{
    /** Minimum payload size; the tail beyond the last triple is reserved. */
    public static final int SIZE = 172;

    public SystemMotion {
        MessageHeader.requireU32(platformId, "platformId");
        MessageHeader.requireU32(validity, "validity");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(attitude, "attitude");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(angularVelocity, "angularVelocity");
        Objects.requireNonNull(acceleration, "acceleration");
    }

    public double latitudeDegrees() {
        return Math.toDegrees(position.x());
    }

    public double longitudeDegrees() {
        return Math.toDegrees(position.y());
    }

    public double altitudeMeters() {
        return position.z();
    }

    public Vector3 attitudeDegrees() {
        return attitude.toDegrees();
    }

    public Vector3 angularVelocityDegrees() {
        return angularVelocity.toDegrees();
    }
}
