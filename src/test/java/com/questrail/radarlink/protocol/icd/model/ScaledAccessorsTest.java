package com.questrail.radarlink.protocol.icd.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScaledAccessorsTest {

    private static final double EPS = 1e-9;

    @Test
    void sensorPositionScalesFixedPointFields() {
        SensorPosition p = new SensorPosition(325_000_000, -1_170_000_000, 1_500, 90_000, -2_500, 1_250);

        assertEquals(32.5, p.latitudeDegrees(), EPS);
        assertEquals(-117.0, p.longitudeDegrees(), EPS);
        assertEquals(1.5, p.altitudeMeters(), EPS);
        assertEquals(90.0, p.headingDegrees(), EPS);
        assertEquals(-2.5, p.pitchDegrees(), EPS);
        assertEquals(1.25, p.rollDegrees(), EPS);
    }

    @Test
    void systemMotionConvertsRadiansToDegrees() {
        SystemMotion m = new SystemMotion(0L, 1, 0,
                new Vector3(Math.PI / 6, -Math.PI / 4, 250.0),
                new Vector3(Math.PI, 0.0, -Math.PI / 2),
                Vector3.ZERO,
                new Vector3(0.1, 0.2, 0.3),
                Vector3.ZERO);

        assertEquals(30.0, m.latitudeDegrees(), EPS);
        assertEquals(-45.0, m.longitudeDegrees(), EPS);
        assertEquals(250.0, m.altitudeMeters(), EPS);

        Vector3 attitude = m.attitudeDegrees();
        assertEquals(180.0, attitude.x(), EPS);
        assertEquals(0.0, attitude.y(), EPS);
        assertEquals(-90.0, attitude.z(), EPS);

        Vector3 rates = m.angularVelocityDegrees();
        assertEquals(Math.toDegrees(0.1), rates.x(), EPS);
        assertEquals(Math.toDegrees(0.2), rates.y(), EPS);
        assertEquals(Math.toDegrees(0.3), rates.z(), EPS);
    }

    @Test
    void targetRecordScalesWireUnits() {
        Target t = new Target(1, 12_345L, 359_999, 1_500, -1_050, 735, 2, 80);

        assertEquals(12.345, t.rangeMeters(), EPS);
        assertEquals(359.999, t.azimuthDegrees(), EPS);
        assertEquals(1.5, t.elevationDegrees(), EPS);
        assertEquals(-10.5, t.velocityMetersPerSecond(), EPS);
        assertEquals(7.35, t.rcsDbsm(), EPS);
    }

    @Test
    void geoLocationDegreesFollowsAvailabilityFlag() {
        TargetData withGeo = targetData(AvailabilityFlags.of(AvailabilityFlags.Field.GEO_LOCATION), 3);
        Vector3 geo = withGeo.geoLocationDegrees().orElseThrow();
        assertEquals(Math.toDegrees(0.55), geo.x(), EPS);
        assertEquals(Math.toDegrees(-0.2), geo.y(), EPS);
        assertEquals(80.0, geo.z(), EPS);

        TargetData withoutGeo = targetData(AvailabilityFlags.NONE, 3);
        assertTrue(withoutGeo.geoLocationDegrees().isEmpty());
    }

    @Test
    void targetStatusResolvesKnownCodesOnly() {
        assertEquals(TargetStatus.EXTRAPOLATE,
                targetData(AvailabilityFlags.NONE, 3).targetStatus().orElseThrow());
        assertTrue(targetData(AvailabilityFlags.NONE, 99).targetStatus().isEmpty());
    }

    @Test
    void availabilityFieldsListsSetBitsOnly() {
        assertEquals(Set.of(), AvailabilityFlags.NONE.fields());
        assertEquals(Set.of(AvailabilityFlags.Field.CARTESIAN_LOCATION, AvailabilityFlags.Field.CARTESIAN_VARIANCE),
                new AvailabilityFlags(0x41).fields());
        assertEquals(Set.of(AvailabilityFlags.Field.values()), new AvailabilityFlags(0xFF).fields());
    }

    private static TargetData targetData(AvailabilityFlags flags, long status) {
        return new TargetData(
                1, 0L, 0L, 0, status, 0.0, 0, 0.0, 0, 0.0,
                Vector3.ZERO, 0.0, 0.0, Vector3.ZERO,
                0, 0, flags,
                new Vector3(0.55, -0.2, 80.0),
                Vector3.ZERO, Vector3.ZERO, Vector3.ZERO, Vector3.ZERO,
                Vector3.ZERO, Vector3.ZERO, Vector3.ZERO);
    }
}
