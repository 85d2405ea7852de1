package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.config.SystemControlLayout;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RadarMessage → bytes → RadarMessage preserves every field, for every
 * message variant the link exchanges.
 */
final class RadarMessageRoundTripTest
{
    private static final MessageStamp STAMP = new MessageStamp(0x1000, 43_200_000L, 77);

    private static final Target TARGET = new Target(42, 12_345_678L, 90_500, 2_250, -1_050, 735, 3, 91);

    private static final TargetData TARGET_DATA = new TargetData(
            9, 5_000L, 5_250L, 2, 1, 0.87, 2, 0.6, 14, 3.5,
            new Vector3(0.7, 0.05, 2500.0), 31.0, 0.25, new Vector3(0.002, 0.002, 7.5),
            3, 0, AvailabilityFlags.of(AvailabilityFlags.Field.GEO_LOCATION, AvailabilityFlags.Field.POLAR_VELOCITY),
            new Vector3(0.5, 0.6, 100.0),
            Vector3.ZERO, Vector3.ZERO, Vector3.ZERO, Vector3.ZERO,
            new Vector3(1.5, -0.5, 0.0), new Vector3(0.1, 0.1, 0.1), Vector3.ZERO);

    private static final PlotData PLOT = new PlotData(5_100L, 4, new Vector3(0.71, 0.05, 2499.0), 2.75, 21.5,
            new Vector3(0.003, 0.003, 6.0), 0.4);

    private static List<RadarMessage> everyVariant() {
        return List.of(
                KeepAlive.empty(),
                new KeepAlive(new byte[] {0, 0, 0, 0}),
                new Acknowledge(0xFFFF_FFFEL),
                new SystemControl(4, 1, 0x0001_0100L, 0x0100_0001L, 2),
                SystemStatus.basic(3, 1, 0),
                new SystemStatus(3, 1, 0, OptionalLong.of(245), OptionalLong.empty(), OptionalLong.empty()),
                new SystemStatus(2, 2, 0x10, OptionalLong.of(300), OptionalLong.of(0x5), OptionalLong.of(27_000)),
                TargetReport.of(List.of(TARGET, new Target(43, 1_000L, 0, 0, 0, 0, 0, 0))),
                new TargetReport(5, List.of(TARGET)),
                new SingleTargetReport(TARGET),
                new SingleTargetExtended(TARGET_DATA, PLOT),
                new SystemMotion(1_000L, 7, 0xFF,
                        new Vector3(0.5, 0.6, 42.0), new Vector3(0.1, -0.1, 1.0),
                        new Vector3(1, 2, 3), new Vector3(0.01, 0.02, 0.03), new Vector3(0, 0, 9.81)),
                new SensorPosition(325_000_000, -1_170_000_000, 1_500, 90_000, -2_500, 1_250),
                new GenericMessage(MessageKind.RADAR_DATA_STREAM.defaultId(), new byte[] {9, 8, 7, 6, 5}),
                new GenericMessage(0x1234_5678L, new byte[0]));
    }

    private final MessageHeaderCodec headerCodec = new MessageHeaderCodec(HeaderFieldOrder.SOURCE_FIRST);
    private final MessageRegistry registry = MessageRegistry.standard(MessageCatalog.defaults(), SystemControlLayout.ICD_40);
    private final DefaultRadarMessageEncoder encoder = new DefaultRadarMessageEncoder(headerCodec, registry);
    private final DefaultRadarMessageDecoder decoder = new DefaultRadarMessageDecoder(headerCodec, registry);

    private DecodedMessage roundTrip(RadarMessage original) {
        byte[] bytes = encoder.encode(STAMP, original);
        DecodeResult result = decoder.decode(bytes);
        return assertInstanceOf(DecodeResult.Decoded.class, result, () -> "failed: " + original).message();
    }

    @Test
    void everyVariantRoundTrips()
    {
        List<Executable> checks = new ArrayList<>();
        for (RadarMessage original : everyVariant()) {
            checks.add(() -> {
                DecodedMessage decoded = roundTrip(original);
                assertEquals(original, decoded.body(), original.toString());
                assertFalse(decoded.hasWarnings(), original.toString());
                assertEquals(STAMP.sequenceNumber(), decoded.header().sequenceNumber());
            });
        }
        assertAll(checks);
    }

    @Test
    void sixteenByteStatusKeepsOnlyTemperature()
    {
        SystemStatus status = new SystemStatus(3, 1, 0, OptionalLong.of(245), OptionalLong.empty(), OptionalLong.empty());

        DecodedMessage decoded = roundTrip(status);

        assertEquals(16, decoded.header().declaredPayloadLength());
        SystemStatus back = (SystemStatus) decoded.body();
        assertEquals(24.5, back.temperatureCelsius().getAsDouble(), 1e-9);
        assertTrue(back.powerStatus().isEmpty());
        assertTrue(back.antennaPositionDegrees().isEmpty());
    }

    @Test
    void truncatedTargetReportStaysTruncated()
    {
        TargetReport back = (TargetReport) roundTrip(new TargetReport(5, List.of(TARGET))).body();

        assertTrue(back.truncated());
        assertEquals(5, back.declaredCount());
        assertEquals(List.of(TARGET), back.targets());
    }

    @Test
    void declaredPayloadLengthMatchesEncodedBody()
    {
        assertEquals(0, roundTrip(KeepAlive.empty()).header().declaredPayloadLength());
        assertEquals(4, roundTrip(new Acknowledge(1)).header().declaredPayloadLength());
        assertEquals(SystemControlLayout.ICD_40.payloadSize(),
                roundTrip(new SystemControl(2, 0, 0, 0, 0)).header().declaredPayloadLength());
        assertEquals(SingleTargetExtended.SIZE,
                roundTrip(new SingleTargetExtended(TARGET_DATA, PLOT)).header().declaredPayloadLength());
    }

    @Test
    void extendedTargetExposesStatusAndFlags()
    {
        SingleTargetExtended back = (SingleTargetExtended) roundTrip(new SingleTargetExtended(TARGET_DATA, PLOT)).body();

        assertEquals(TargetStatus.UPDATE, back.target().targetStatus().orElseThrow());
        assertEquals(
                EnumSet.of(AvailabilityFlags.Field.GEO_LOCATION, AvailabilityFlags.Field.POLAR_VELOCITY),
                back.target().flags().fields());

        Vector3 geo = back.target().geoLocationDegrees().orElseThrow();
        assertEquals(Math.toDegrees(0.5), geo.x(), 1e-12);
        assertEquals(Math.toDegrees(0.6), geo.y(), 1e-12);
        assertEquals(100.0, geo.z(), 1e-12);
    }
}
