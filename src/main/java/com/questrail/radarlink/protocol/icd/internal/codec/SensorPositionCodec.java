package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.SensorPosition;

import java.nio.ByteBuffer;

/**
 * Sensor position payload: six signed little-endian i32 fixed-point values.
 */
public final class SensorPositionCodec implements PayloadCodec<SensorPosition>
{
    @Override
    public MessageKind kind() {
        return MessageKind.SENSOR_POSITION;
    }

    @Override
    public Class<SensorPosition> messageType() {
        return SensorPosition.class;
    }

    @Override
    public SensorPosition decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, SensorPosition.SIZE, "Sensor Position");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        return new SensorPosition(buf.getInt(), buf.getInt(), buf.getInt(),
                buf.getInt(), buf.getInt(), buf.getInt());
    }

    @Override
    public byte[] encode(SensorPosition message) {
        ByteBuffer buf = LittleEndianBuffers.writer(SensorPosition.SIZE);
        buf.putInt(message.latitudeE7());
        buf.putInt(message.longitudeE7());
        buf.putInt(message.altitudeMillimeters());
        buf.putInt(message.headingMilliDeg());
        buf.putInt(message.pitchMilliDeg());
        buf.putInt(message.rollMilliDeg());
        return buf.array();
    }
}
