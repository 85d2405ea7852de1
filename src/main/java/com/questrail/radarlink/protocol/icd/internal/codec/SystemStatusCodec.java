package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.SystemStatus;

import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * SystemStatusCodec
 * -----------------------------------------------------------------------------
 * Progressive decoder for the status payload.
 *
 * <p>Presence of each optional field is decided by payload length alone:
 * 12 bytes carry the mandatory triple, and every further 4 bytes add the next
 * field in order (temperature, power status, antenna position). Bytes past
 * 24 are ignored.</p>
 */
public final class SystemStatusCodec implements PayloadCodec<SystemStatus>
{
    static final int MANDATORY_SIZE = 12;

    @Override
    public MessageKind kind() {
        return MessageKind.SYSTEM_STATUS;
    }

    @Override
    public Class<SystemStatus> messageType() {
        return SystemStatus.class;
    }

    @Override
    public SystemStatus decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, MANDATORY_SIZE, "System Status");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        long radarState = LittleEndianBuffers.getU32(buf);
        long operatingMode = LittleEndianBuffers.getU32(buf);
        long errorCode = LittleEndianBuffers.getU32(buf);

        OptionalLong temperature = optionalU32(buf);
        OptionalLong powerStatus = temperature.isPresent() ? optionalU32(buf) : OptionalLong.empty();
        OptionalLong antenna = powerStatus.isPresent() ? optionalU32(buf) : OptionalLong.empty();

        return new SystemStatus(radarState, operatingMode, errorCode, temperature, powerStatus, antenna);
    }

    @Override
    public byte[] encode(SystemStatus message) {
        ByteBuffer buf = LittleEndianBuffers.writer(message.encodedLength());
        LittleEndianBuffers.putU32(buf, message.radarState());
        LittleEndianBuffers.putU32(buf, message.operatingMode());
        LittleEndianBuffers.putU32(buf, message.errorCode());
        message.temperature().ifPresent(v -> LittleEndianBuffers.putU32(buf, v));
        message.powerStatus().ifPresent(v -> LittleEndianBuffers.putU32(buf, v));
        message.antennaPosition().ifPresent(v -> LittleEndianBuffers.putU32(buf, v));
        return buf.array();
    }

    private static OptionalLong optionalU32(ByteBuffer buf) {
        return buf.remaining() >= 4 ? OptionalLong.of(LittleEndianBuffers.getU32(buf)) : OptionalLong.empty();
    }
}
