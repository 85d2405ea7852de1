package com.questrail.radarlink.protocol.icd.model;

/**
 * Sensor position report: six signed 32-bit fixed-point values.
 *
 * <ul>
 *   <li>latitude, longitude: 1e-7 degree</li>
 *   <li>altitude: millimetres</li>
 *   <li>heading, pitch, roll: thousandths of a degree</li>
 * </ul>
 */
public record SensorPosition(
        int latitudeE7,
        int longitudeE7,
        int altitudeMillimeters,
        int headingMilliDeg,
        int pitchMilliDeg,
        int rollMilliDeg
) implements RadarMessage
{
    /** Minimum payload size. */
    public static final int SIZE = 24;

    public double latitudeDegrees() {
        return latitudeE7 / 1e7;
    }

    public double longitudeDegrees() {
        return longitudeE7 / 1e7;
    }

    public double altitudeMeters() {
        return altitudeMillimeters / 1000.0;
    }

    public double headingDegrees() {
        return headingMilliDeg / 1000.0;
    }

    public double pitchDegrees() {
        return pitchMilliDeg / 1000.0;
    }

    public double rollDegrees() {
        return rollMilliDeg / 1000.0;
    }
}
