package com.questrail.radarlink.protocol.icd.model;

import com.questrail.radarlink.protocol.icd.model.AvailabilityFlags.Field;

import java.util.Objects;
import java.util.Optional;

/**
 * TargetData
 * -----------------------------------------------------------------------------
 * The 332-byte track record at the front of a single-target-extended message.
 *
 * <h2>Layout</h2>
 * The record has a fixed layout. The mandatory block (identity, timing,
 * classification, polar position and its sigma) is followed by the
 * availability flag byte and eight 24-byte triples:
 *
 * <pre>
 *   136 geoLocation            (lat rad, lon rad, alt m)   GEO_LOCATION
 *   160 cartesianLocation                                  CARTESIAN_LOCATION
 *   184 cartesianVelocity                                  CARTESIAN_VELOCITY
 *   208 cartesianSigma                                     CARTESIAN_VARIANCE
 *   232 cartesianVelocitySigma                             CARTESIAN_VARIANCE
 *   256 polarVelocity                                      POLAR_VELOCITY
 *   280 polarVelocityVariance                              POLAR_VELOCITY
 *   304 absoluteVelocity       (east, north, up)           ABSOLUTE_VELOCITY
 * </pre>
 *
 * <p>A triple whose flag is clear is still decoded (and re-encoded) as-is;
 * the {@code ...IfAvailable()} accessors hide it from callers who only want
 * meaningful values.</p>
 */
public record TargetData(
        long id,
        long detectionTime,
        long updateTime,
        long source,
        long status,
        double score,
        long classification,
        double classificationConfidence,
        long seniority,
        double rcs,
        Vector3 polarPosition,
        double velocity,
        double course,
        Vector3 polarSigma,
        long dimensionality,
        long coordinateSystem,
        AvailabilityFlags flags,
        Vector3 geoLocation,
        Vector3 cartesianLocation,
        Vector3 cartesianVelocity,
        Vector3 cartesianSigma,
        Vector3 cartesianVelocitySigma,
        Vector3 polarVelocity,
        Vector3 polarVelocityVariance,
        Vector3 absoluteVelocity
) {
    /** Encoded size of the record. */
    public static final int SIZE = 332;

    public TargetData {
        MessageHeader.requireU32(id, "id");
        MessageHeader.requireU32(source, "source");
        MessageHeader.requireU32(status, "status");
        MessageHeader.requireU32(classification, "classification");
        MessageHeader.requireU32(seniority, "seniority");
        MessageHeader.requireU32(dimensionality, "dimensionality");
        MessageHeader.requireU32(coordinateSystem, "coordinateSystem");
        Objects.requireNonNull(polarPosition, "polarPosition");
        Objects.requireNonNull(polarSigma, "polarSigma");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(geoLocation, "geoLocation");
        Objects.requireNonNull(cartesianLocation, "cartesianLocation");
        Objects.requireNonNull(cartesianVelocity, "cartesianVelocity");
        Objects.requireNonNull(cartesianSigma, "cartesianSigma");
        Objects.requireNonNull(cartesianVelocitySigma, "cartesianVelocitySigma");
        Objects.requireNonNull(polarVelocity, "polarVelocity");
        Objects.requireNonNull(polarVelocityVariance, "polarVelocityVariance");
        Objects.requireNonNull(absoluteVelocity, "absoluteVelocity");
    }

    public Optional<TargetStatus> targetStatus() {
        return TargetStatus.fromCode(status);
    }

    public Optional<TargetClass> targetClass() {
        return TargetClass.fromCode(classification);
    }

    public Optional<Vector3> geoLocationIfAvailable() {
        return when(Field.GEO_LOCATION, geoLocation);
    }

    /**
     * Geodetic position with latitude and longitude in degrees; altitude unchanged.
     */
    public Optional<Vector3> geoLocationDegrees() {
        return geoLocationIfAvailable()
                .map(g -> new Vector3(Math.toDegrees(g.x()), Math.toDegrees(g.y()), g.z()));
    }

    public Optional<Vector3> cartesianLocationIfAvailable() {
        return when(Field.CARTESIAN_LOCATION, cartesianLocation);
    }

    public Optional<Vector3> cartesianVelocityIfAvailable() {
        return when(Field.CARTESIAN_VELOCITY, cartesianVelocity);
    }

    public Optional<Vector3> cartesianSigmaIfAvailable() {
        return when(Field.CARTESIAN_VARIANCE, cartesianSigma);
    }

    public Optional<Vector3> cartesianVelocitySigmaIfAvailable() {
        return when(Field.CARTESIAN_VARIANCE, cartesianVelocitySigma);
    }

    public Optional<Vector3> polarVelocityIfAvailable() {
        return when(Field.POLAR_VELOCITY, polarVelocity);
    }

    public Optional<Vector3> polarVelocityVarianceIfAvailable() {
        return when(Field.POLAR_VELOCITY, polarVelocityVariance);
    }

    public Optional<Vector3> absoluteVelocityIfAvailable() {
        return when(Field.ABSOLUTE_VELOCITY, absoluteVelocity);
    }

    private Optional<Vector3> when(Field field, Vector3 value) {
        return flags.isSet(field) ? Optional.of(value) : Optional.empty();
    }
}
