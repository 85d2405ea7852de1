package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.Vector3;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Little-endian buffer helpers shared by the header and payload codecs.
 *
 * <p>Every multi-byte field on the link is little-endian. Unsigned 32-bit
 * values are widened to {@code long}.</p>
 */
public final class LittleEndianBuffers
{
    private LittleEndianBuffers() {}

    public static ByteBuffer reader(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static ByteBuffer writer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static long getU32(ByteBuffer buf) {
        return Integer.toUnsignedLong(buf.getInt());
    }

    public static long getU32(ByteBuffer buf, int index) {
        return Integer.toUnsignedLong(buf.getInt(index));
    }

    public static void putU32(ByteBuffer buf, long value) {
        buf.putInt((int) value);
    }

    public static void putU32(ByteBuffer buf, int index, long value) {
        buf.putInt(index, (int) value);
    }

    public static Vector3 getVector3(ByteBuffer buf) {
        return new Vector3(buf.getDouble(), buf.getDouble(), buf.getDouble());
    }

    public static void putVector3(ByteBuffer buf, Vector3 v) {
        buf.putDouble(v.x());
        buf.putDouble(v.y());
        buf.putDouble(v.z());
    }
}
