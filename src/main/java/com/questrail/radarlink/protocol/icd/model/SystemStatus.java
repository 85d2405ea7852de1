package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

/**
 * System status report (radar controller to C2).
 *
 * <p>
 * The payload grows progressively: the first three fields are mandatory and
 * each optional field is present only when the payload is long enough to hold
 * it <em>and</em> every field before it.
 * </p>
 *
 * <pre>
 *   12 bytes: radarState, operatingMode, errorCode
 *   16 bytes: + temperature   (tenths of a degree Celsius)
 *   20 bytes: + powerStatus   (bitmask, see {@link PowerSubsystem})
 *   24 bytes: + antennaPosition (hundredths of a degree)
 * </pre>
 *
 * <p>
 * Raw wire values are stored so that the record re-encodes exactly; scaled
 * values are available through the accessor helpers.
 * </p>
 */
public record SystemStatus(
        long radarState,
        long operatingMode,
        long errorCode,
        OptionalLong temperature,
        OptionalLong powerStatus,
        OptionalLong antennaPosition
) implements RadarMessage
{
    public SystemStatus {
        MessageHeader.requireU32(radarState, "radarState");
        MessageHeader.requireU32(operatingMode, "operatingMode");
        MessageHeader.requireU32(errorCode, "errorCode");
        Objects.requireNonNull(temperature, "temperature");
        Objects.requireNonNull(powerStatus, "powerStatus");
        Objects.requireNonNull(antennaPosition, "antennaPosition");

        if (powerStatus.isPresent() && temperature.isEmpty()) {
            throw new IllegalArgumentException("powerStatus requires temperature");
        }
        if (antennaPosition.isPresent() && powerStatus.isEmpty()) {
            throw new IllegalArgumentException("antennaPosition requires powerStatus");
        }
    }

    /**
     * Status carrying only the three mandatory fields.
     */
    public static SystemStatus basic(long radarState, long operatingMode, long errorCode) {
        return new SystemStatus(radarState, operatingMode, errorCode,
                OptionalLong.empty(), OptionalLong.empty(), OptionalLong.empty());
    }

    /**
     * Number of payload bytes this status occupies on the wire.
     */
    public int encodedLength() {
        if (antennaPosition.isPresent()) {
            return 24;
        }
        if (powerStatus.isPresent()) {
            return 20;
        }
        if (temperature.isPresent()) {
            return 16;
        }
        return 12;
    }

    public Optional<RadarStatusState> radarStatusState() {
        return RadarStatusState.fromCode(radarState);
    }

    public Optional<OperatingMode> mode() {
        return OperatingMode.fromCode(operatingMode);
    }

    public ErrorSeverity errorSeverity() {
        return ErrorSeverity.classify(errorCode);
    }

    public OptionalDouble temperatureCelsius() {
        return temperature.isPresent()
                ? OptionalDouble.of(temperature.getAsLong() / 10.0)
                : OptionalDouble.empty();
    }

    public Set<PowerSubsystem> poweredSubsystems() {
        return PowerSubsystem.fromBitmask(powerStatus.orElse(0L));
    }

    public OptionalDouble antennaPositionDegrees() {
        return antennaPosition.isPresent()
                ? OptionalDouble.of(antennaPosition.getAsLong() / 100.0)
                : OptionalDouble.empty();
    }
}
