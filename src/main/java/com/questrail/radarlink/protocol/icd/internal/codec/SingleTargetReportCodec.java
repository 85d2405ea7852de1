package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.SingleTargetReport;
import com.questrail.radarlink.protocol.icd.model.Target;

import java.nio.ByteBuffer;

public final class SingleTargetReportCodec implements PayloadCodec<SingleTargetReport>
{
    @Override
    public MessageKind kind() {
        return MessageKind.SINGLE_TARGET_REPORT;
    }

    @Override
    public Class<SingleTargetReport> messageType() {
        return SingleTargetReport.class;
    }

    @Override
    public SingleTargetReport decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, Target.SIZE, "Single Target Report");
        return new SingleTargetReport(TargetCodec.read(LittleEndianBuffers.reader(payload)));
    }

    @Override
    public byte[] encode(SingleTargetReport message) {
        ByteBuffer buf = LittleEndianBuffers.writer(Target.SIZE);
        TargetCodec.write(buf, message.target());
        return buf.array();
    }
}
