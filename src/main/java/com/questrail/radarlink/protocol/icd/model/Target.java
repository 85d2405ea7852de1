package com.questrail.radarlink.protocol.icd.model;

import java.util.Optional;

/**
 * One 32-byte target record as carried by target reports.
 *
 * <p>
 * Fields are kept in their wire units so the record re-encodes exactly.
 * Use the scaled accessors for engineering units.
 * </p>
 *
 * @param id                 track identifier
 * @param rangeMillimeters   slant range, millimetres
 * @param azimuthMilliDeg    azimuth, thousandths of a degree
 * @param elevationMilliDeg  elevation, thousandths of a degree
 * @param velocityCentiMps   radial velocity, hundredths of m/s (signed)
 * @param rcsCentiDbsm       radar cross section, hundredths of dBsm (signed)
 * @param classification     classification code (see {@link TargetClass})
 * @param confidencePercent  classification confidence, percent
 */
public record Target(
        long id,
        long rangeMillimeters,
        long azimuthMilliDeg,
        long elevationMilliDeg,
        int velocityCentiMps,
        int rcsCentiDbsm,
        int classification,
        int confidencePercent
) {
    /** Encoded size of one target record. */
    public static final int SIZE = 32;

    public Target {
        MessageHeader.requireU32(id, "id");
        MessageHeader.requireU32(rangeMillimeters, "rangeMillimeters");
        MessageHeader.requireU32(azimuthMilliDeg, "azimuthMilliDeg");
        MessageHeader.requireU32(elevationMilliDeg, "elevationMilliDeg");
    }

    public double rangeMeters() {
        return rangeMillimeters / 1000.0;
    }

    public double azimuthDegrees() {
        return azimuthMilliDeg / 1000.0;
    }

    public double elevationDegrees() {
        return elevationMilliDeg / 1000.0;
    }

    public double velocityMetersPerSecond() {
        return velocityCentiMps / 100.0;
    }

    public double rcsDbsm() {
        return rcsCentiDbsm / 100.0;
    }

    public Optional<TargetClass> targetClass() {
        return TargetClass.fromCode(classification);
    }
}
