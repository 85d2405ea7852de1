package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.Target;
import com.questrail.radarlink.protocol.icd.model.TargetReport;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-target report: a u32 count followed by that many 32-byte records.
 *
 * <p>Only complete records are decoded. When the payload holds fewer than the
 * declared count the report comes back truncated rather than failing; a
 * trailing partial record is ignored.</p>
 */
public final class TargetReportCodec implements PayloadCodec<TargetReport>
{
    static final int COUNT_SIZE = 4;

    @Override
    public MessageKind kind() {
        return MessageKind.TARGET_REPORT;
    }

    @Override
    public Class<TargetReport> messageType() {
        return TargetReport.class;
    }

    @Override
    public TargetReport decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, COUNT_SIZE, "Target Report");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        long declared = LittleEndianBuffers.getU32(buf);
        long available = (payload.length - COUNT_SIZE) / Target.SIZE;
        int n = (int) Math.min(declared, available);

        List<Target> targets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            targets.add(TargetCodec.read(buf));
        }
        return new TargetReport(declared, targets);
    }

    @Override
    public byte[] encode(TargetReport message) {
        ByteBuffer buf = LittleEndianBuffers.writer(COUNT_SIZE + message.targets().size() * Target.SIZE);
        LittleEndianBuffers.putU32(buf, message.declaredCount());
        for (Target t : message.targets()) {
            TargetCodec.write(buf, t);
        }
        return buf.array();
    }
}
