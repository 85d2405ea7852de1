package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.config.SystemControlLayout;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.model.KeepAlive;
import com.questrail.radarlink.protocol.icd.model.MessageCatalog;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;
import com.questrail.radarlink.protocol.icd.model.MessageStamp;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessageFactoryTest {

    private static final Instant TEN_THIRTY_UTC = Instant.parse("2026-03-14T10:30:15.250Z");

    private final MessageHeaderCodec headerCodec = new MessageHeaderCodec(HeaderFieldOrder.SOURCE_FIRST);
    private final DefaultRadarMessageEncoder encoder = new DefaultRadarMessageEncoder(headerCodec,
            MessageRegistry.standard(MessageCatalog.defaults(), SystemControlLayout.ICD_40));

    @Test
    void firstMessageCarriesSequenceOne() {
        OutboundMessageFactory factory = new OutboundMessageFactory(
                encoder, 0x1000, () -> TEN_THIRTY_UTC, ZoneOffset.UTC);

        assertEquals(0, factory.lastSequenceNumber());
        assertEquals(1, factory.nextStamp().sequenceNumber());
        assertEquals(2, factory.nextStamp().sequenceNumber());
        assertEquals(2, factory.lastSequenceNumber());
    }

    @Test
    void sequenceWrapsToOneAndNeverZero() {
        OutboundMessageFactory factory = new OutboundMessageFactory(
                encoder, 0x1000, () -> TEN_THIRTY_UTC, ZoneOffset.UTC, MessageHeader.U32_MAX - 1);

        assertEquals(MessageHeader.U32_MAX, factory.nextStamp().sequenceNumber());
        assertEquals(1, factory.nextStamp().sequenceNumber());
    }

    @Test
    void timeTagIsMillisecondsSinceMidnightInZone() {
        OutboundMessageFactory utc = new OutboundMessageFactory(
                encoder, 0x1000, () -> TEN_THIRTY_UTC, ZoneOffset.UTC);
        MessageStamp stamp = utc.nextStamp();
        assertEquals((10 * 3600 + 30 * 60 + 15) * 1000L + 250, stamp.timeTag());

        OutboundMessageFactory plusTwo = new OutboundMessageFactory(
                encoder, 0x1000, () -> TEN_THIRTY_UTC, ZoneId.of("+02:00"));
        assertEquals((12 * 3600 + 30 * 60 + 15) * 1000L + 250, plusTwo.nextStamp().timeTag());
    }

    @Test
    void buildStampsAndEncodes() {
        OutboundMessageFactory factory = new OutboundMessageFactory(
                encoder, 0xABCD, () -> TEN_THIRTY_UTC, ZoneOffset.UTC);

        factory.build(KeepAlive.empty());
        byte[] second = factory.build(KeepAlive.empty());

        MessageHeader header = headerCodec.decode(second).orElseThrow();
        assertEquals(0xABCD, header.sourceId());
        assertEquals(2, header.sequenceNumber());
        assertEquals(20, header.messageLength());
    }

    @Test
    void sourceIdMustFitU32() {
        assertThrows(IllegalArgumentException.class,
                () -> new OutboundMessageFactory(encoder, -1, () -> TEN_THIRTY_UTC, ZoneOffset.UTC));
    }
}
