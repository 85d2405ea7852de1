package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.config.SystemControlLayout;
import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.SystemControl;

import java.nio.ByteBuffer;
import java.util.Objects;

import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.getU32;
import static com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers.putU32;

/**
 * System control payload, positioned by a {@link SystemControlLayout}.
 */
public final class SystemControlCodec implements PayloadCodec<SystemControl>
{
    private final SystemControlLayout layout;

    public SystemControlCodec(SystemControlLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public SystemControlLayout layout() {
        return layout;
    }

    @Override
    public MessageKind kind() {
        return MessageKind.SYSTEM_CONTROL;
    }

    @Override
    public Class<SystemControl> messageType() {
        return SystemControl.class;
    }

    @Override
    public SystemControl decode(byte[] payload) throws InsufficientPayloadException {
        InsufficientPayloadException.requireAtLeast(payload, layout.payloadSize(),
                "System Control (" + layout.name() + ")");

        ByteBuffer buf = LittleEndianBuffers.reader(payload);
        return new SystemControl(
                getU32(buf, layout.radarStateOffset()),
                getU32(buf, layout.missionCategoryOffset()),
                getU32(buf, layout.sensorControlsOffset()),
                getU32(buf, layout.radarControlsOffset()),
                getU32(buf, layout.frequencyIndexOffset()));
    }

    @Override
    public byte[] encode(SystemControl message) {
        ByteBuffer buf = LittleEndianBuffers.writer(layout.payloadSize());
        putU32(buf, layout.radarStateOffset(), message.radarState());
        putU32(buf, layout.missionCategoryOffset(), message.missionCategory());
        putU32(buf, layout.sensorControlsOffset(), message.sensorControls());
        putU32(buf, layout.radarControlsOffset(), message.radarControls());
        putU32(buf, layout.frequencyIndexOffset(), message.frequencyIndex());
        return buf.array();
    }
}
