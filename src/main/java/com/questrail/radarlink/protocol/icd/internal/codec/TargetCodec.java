package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.Target;

import java.nio.ByteBuffer;

/**
 * Reads and writes the 32-byte target record shared by the multi-target and
 * single-target reports.
 *
 * <pre>
 *   u32 id, u32 range, u32 azimuth, u32 elevation,
 *   i32 velocity, i32 rcs, i32 classification, i32 confidence
 * </pre>
 */
final class TargetCodec
{
    private TargetCodec() {}

    static Target read(ByteBuffer buf) {
        return new Target(
                LittleEndianBuffers.getU32(buf),
                LittleEndianBuffers.getU32(buf),
                LittleEndianBuffers.getU32(buf),
                LittleEndianBuffers.getU32(buf),
                buf.getInt(),
                buf.getInt(),
                buf.getInt(),
                buf.getInt());
    }

    static void write(ByteBuffer buf, Target t) {
        LittleEndianBuffers.putU32(buf, t.id());
        LittleEndianBuffers.putU32(buf, t.rangeMillimeters());
        LittleEndianBuffers.putU32(buf, t.azimuthMilliDeg());
        LittleEndianBuffers.putU32(buf, t.elevationMilliDeg());
        buf.putInt(t.velocityCentiMps());
        buf.putInt(t.rcsCentiDbsm());
        buf.putInt(t.classification());
        buf.putInt(t.confidencePercent());
    }
}
