package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.Acknowledge;
import com.questrail.radarlink.protocol.icd.model.MessageKind;

import java.nio.ByteBuffer;

/**
 * Acknowledge payload: the acknowledged sequence number as one u32.
 */
public final class AcknowledgeCodec implements PayloadCodec<Acknowledge>
{
    static final int SIZE = 4;

    @Override
    public MessageKind kind() {
        return MessageKind.ACKNOWLEDGE;
    }

    @Override
    public Class<Acknowledge> messageType() {
        return Acknowledge.class;
    }

    @Override
    public Acknowledge decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, SIZE, "Acknowledge");
        return new Acknowledge(LittleEndianBuffers.getU32(LittleEndianBuffers.reader(payload)));
    }

    @Override
    public byte[] encode(Acknowledge message) {
        ByteBuffer buf = LittleEndianBuffers.writer(SIZE);
        LittleEndianBuffers.putU32(buf, message.acknowledgedSequence());
        return buf.array();
    }
}
