package com.questrail.radarlink.protocol.icd.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SystemStatusTest {

    @Test
    void optionalFieldsMustBeContiguous() {
        assertThrows(IllegalArgumentException.class, () -> new SystemStatus(2, 0, 0,
                OptionalLong.empty(), OptionalLong.of(1), OptionalLong.empty()));
        assertThrows(IllegalArgumentException.class, () -> new SystemStatus(2, 0, 0,
                OptionalLong.of(1), OptionalLong.empty(), OptionalLong.of(1)));
    }

    @Test
    void encodedLengthTracksPresentFields() {
        assertEquals(12, SystemStatus.basic(2, 0, 0).encodedLength());
        assertEquals(16, new SystemStatus(2, 0, 0,
                OptionalLong.of(1), OptionalLong.empty(), OptionalLong.empty()).encodedLength());
        assertEquals(24, new SystemStatus(2, 0, 0,
                OptionalLong.of(1), OptionalLong.of(2), OptionalLong.of(3)).encodedLength());
    }

    @Test
    void interpretedViews() {
        SystemStatus status = new SystemStatus(2, 1, 150,
                OptionalLong.of(0), OptionalLong.of(0x05), OptionalLong.empty());

        assertEquals(Optional.of(RadarStatusState.OPERATIONAL), status.radarStatusState());
        assertEquals(ErrorSeverity.ERROR, status.errorSeverity());
        assertEquals(EnumSet.of(PowerSubsystem.MAIN_POWER, PowerSubsystem.TRANSMITTER), status.poweredSubsystems());
        assertTrue(status.antennaPositionDegrees().isEmpty());
    }

    @Test
    void unknownStateCodeHasNoNamedState() {
        assertTrue(SystemStatus.basic(17, 0, 0).radarStatusState().isEmpty());
    }

    @Test
    void errorSeverityBands() {
        assertEquals(ErrorSeverity.NONE, ErrorSeverity.classify(0));
        assertEquals(ErrorSeverity.WARNING, ErrorSeverity.classify(99));
        assertEquals(ErrorSeverity.ERROR, ErrorSeverity.classify(100));
        assertEquals(ErrorSeverity.CRITICAL, ErrorSeverity.classify(200));
    }
}
