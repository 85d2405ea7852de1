package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.codec.RadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.codec.PayloadCodec;
import com.questrail.radarlink.protocol.icd.model.GenericMessage;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;
import com.questrail.radarlink.protocol.icd.model.MessageStamp;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

import java.util.Objects;

/**
 * Concrete implementation of {@link RadarMessageEncoder}.
 *
 * <p>Generic messages keep the identifier they carry. Every other variant is
 * encoded by its registered payload codec under the identifier the catalog
 * assigns to that codec's kind.</p>
 */
public final class DefaultRadarMessageEncoder implements RadarMessageEncoder
{
    private final MessageHeaderCodec headerCodec;
    private final MessageRegistry registry;

    public DefaultRadarMessageEncoder(MessageHeaderCodec headerCodec, MessageRegistry registry) {
        this.headerCodec = Objects.requireNonNull(headerCodec, "headerCodec");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public byte[] encode(MessageStamp stamp, RadarMessage message)
    {
        Objects.requireNonNull(stamp, "stamp");
        Objects.requireNonNull(message, "message");

        final long messageId;
        final byte[] payload;
        if (message instanceof GenericMessage generic) {
            messageId = generic.messageId();
            payload = generic.payload();
        }
        else {
            PayloadCodec<?> codec = registry.codecForMessage(message);
            messageId = registry.catalog().idOf(codec.kind());
            payload = codec.encodeBody(message);
        }

        MessageHeader header = MessageHeader.forPayload(
                stamp.sourceId(), messageId, payload.length, stamp.timeTag(), stamp.sequenceNumber());

        byte[] out = new byte[MessageHeader.SIZE + payload.length];
        System.arraycopy(headerCodec.encode(header), 0, out, 0, MessageHeader.SIZE);
        System.arraycopy(payload, 0, out, MessageHeader.SIZE, payload.length);
        return out;
    }
}
