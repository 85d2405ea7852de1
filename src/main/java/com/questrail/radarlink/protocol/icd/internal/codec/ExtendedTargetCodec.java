package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.AvailabilityFlags;
import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.PlotData;
import com.questrail.radarlink.protocol.icd.model.SingleTargetExtended;
import com.questrail.radarlink.protocol.icd.model.TargetData;
import com.questrail.radarlink.protocol.icd.model.Vector3;

import java.nio.ByteBuffer;

import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.getU32;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.getVector3;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.putU32;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.putVector3;

/**
 * ExtendedTargetCodec
 * -----------------------------------------------------------------------------
 * Fixed-layout codec for the 508-byte extended single-target payload
 * ({@link TargetData} then {@link PlotData}).
 *
 * <p>The availability flag byte at offset 132 never moves anything: all eight
 * optional triples are read at their fixed offsets regardless of the flags, so
 * a clear bit costs nothing but meaning. Reserved and padding bytes are
 * skipped on decode and written as zero.</p>
 *
 * <p>A payload shorter than 508 bytes is insufficient. A longer one decodes
 * the first 508 bytes; the surplus is visible through the header length
 * warning.</p>
 */
public final class ExtendedTargetCodec implements PayloadCodec<SingleTargetExtended>
{
    static final int FLAGS_OFFSET = 132;
    static final int TRIPLES_OFFSET = 136;

    @Override
    public MessageKind kind() {
        return MessageKind.SINGLE_TARGET_EXTENDED;
    }

    @Override
    public Class<SingleTargetExtended> messageType() {
        return SingleTargetExtended.class;
    }

    @Override
    public SingleTargetExtended decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, SingleTargetExtended.SIZE, "Single Target Extended");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        TargetData target = readTarget(buf);
        buf.position(TargetData.SIZE);
        PlotData plot = readPlot(buf);
        return new SingleTargetExtended(target, plot);
    }

    @Override
    public byte[] encode(SingleTargetExtended message) {
        ByteBuffer buf = LittleEndianBuffers.writer(SingleTargetExtended.SIZE);
        writeTarget(buf, message.target());
        buf.position(TargetData.SIZE);
        writePlot(buf, message.plot());
        return buf.array();
    }

    // ---------------------------------------------------------------------
    // TargetData (332 bytes)
    // ---------------------------------------------------------------------

    private static TargetData readTarget(ByteBuffer buf) {
        long id = getU32(buf);
        long detectionTime = buf.getLong();
        long updateTime = buf.getLong();
        long source = getU32(buf);
        long status = getU32(buf);
        double score = buf.getDouble();
        long classification = getU32(buf);
        double classConfidence = buf.getDouble();
        long seniority = getU32(buf);
        double rcs = buf.getDouble();
        Vector3 polar = getVector3(buf);
        double velocity = buf.getDouble();
        double course = buf.getDouble();
        Vector3 polarSigma = getVector3(buf);
        long dimensionality = getU32(buf);
        long coordinateSystem = getU32(buf);

        AvailabilityFlags flags = new AvailabilityFlags(buf.get(FLAGS_OFFSET) & 0xFF);
        buf.position(TRIPLES_OFFSET);

        return new TargetData(
                id, detectionTime, updateTime, source, status,
                score, classification, classConfidence, seniority, rcs,
                polar, velocity, course, polarSigma,
                dimensionality, coordinateSystem, flags,
                getVector3(buf),   // geo
                getVector3(buf),   // cartesian location
                getVector3(buf),   // cartesian velocity
                getVector3(buf),   // cartesian sigma
                getVector3(buf),   // cartesian velocity sigma
                getVector3(buf),   // polar velocity
                getVector3(buf),   // polar velocity variance
                getVector3(buf));  // absolute velocity
    }

    private static void writeTarget(ByteBuffer buf, TargetData t) {
        putU32(buf, t.id());
        buf.putLong(t.detectionTime());
        buf.putLong(t.updateTime());
        putU32(buf, t.source());
        putU32(buf, t.status());
        buf.putDouble(t.score());
        putU32(buf, t.classification());
        buf.putDouble(t.classificationConfidence());
        putU32(buf, t.seniority());
        buf.putDouble(t.rcs());
        putVector3(buf, t.polarPosition());
        buf.putDouble(t.velocity());
        buf.putDouble(t.course());
        putVector3(buf, t.polarSigma());
        putU32(buf, t.dimensionality());
        putU32(buf, t.coordinateSystem());

        buf.put(FLAGS_OFFSET, (byte) t.flags().bits());
        buf.position(TRIPLES_OFFSET);

        putVector3(buf, t.geoLocation());
        putVector3(buf, t.cartesianLocation());
        putVector3(buf, t.cartesianVelocity());
        putVector3(buf, t.cartesianSigma());
        putVector3(buf, t.cartesianVelocitySigma());
        putVector3(buf, t.polarVelocity());
        putVector3(buf, t.polarVelocityVariance());
        putVector3(buf, t.absoluteVelocity());
    }

    // ---------------------------------------------------------------------
    // PlotData (176 bytes)
    // ---------------------------------------------------------------------

    private static PlotData readPlot(ByteBuffer buf) {
        long time = buf.getLong();
        long id = getU32(buf);
        buf.getInt(); // reserved
        Vector3 polar = getVector3(buf);
        double doppler = buf.getDouble();
        double snr = buf.getDouble();
        Vector3 sigma = getVector3(buf);
        double dopplerSigma = buf.getDouble();
        return new PlotData(time, id, polar, doppler, snr, sigma, dopplerSigma);
    }

    private static void writePlot(ByteBuffer buf, PlotData p) {
        buf.putLong(p.time());
        putU32(buf, p.id());
        buf.putInt(0);
        putVector3(buf, p.polarPosition());
        buf.putDouble(p.doppler());
        buf.putDouble(p.snr());
        putVector3(buf, p.polarSigma());
        buf.putDouble(p.dopplerSigma());
    }
}
