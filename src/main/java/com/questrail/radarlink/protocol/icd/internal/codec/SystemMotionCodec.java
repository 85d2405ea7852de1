package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.SystemMotion;

import java.nio.ByteBuffer;

import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.getU32;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.getVector3;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.putU32;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.putVector3;

/**
 * Platform motion payload.
 *
 * <pre>
 *   0   timeTag          u64
 *   8   platformId       u32
 *   12  validity         u32
 *   16  position         3 x f64
 *   40  attitude         3 x f64
 *   64  velocity         3 x f64
 *   88  angularVelocity  3 x f64
 *   112 acceleration     3 x f64
 *   136 reserved         36 bytes
 * </pre>
 */
public final class SystemMotionCodec implements PayloadCodec<SystemMotion>
{
    @Override
    public MessageKind kind() {
        return MessageKind.SYSTEM_MOTION;
    }

    @Override
    public Class<SystemMotion> messageType() {
        return SystemMotion.class;
    }

    @Override
    public SystemMotion decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, SystemMotion.SIZE, "System Motion");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        return new SystemMotion(
                buf.getLong(),
                getU32(buf),
                getU32(buf),
                getVector3(buf),
                getVector3(buf),
                getVector3(buf),
                getVector3(buf),
                getVector3(buf));
    }

    @Override
    public byte[] encode(SystemMotion message) {
        ByteBuffer buf = LittleEndianBuffers.writer(SystemMotion.SIZE);
        buf.putLong(message.timeTag());
        putU32(buf, message.platformId());
        putU32(buf, message.validity());
        putVector3(buf, message.position());
        putVector3(buf, message.attitude());
        putVector3(buf, message.velocity());
        putVector3(buf, message.angularVelocity());
        putVector3(buf, message.acceleration());
        return buf.array();
    }
}
