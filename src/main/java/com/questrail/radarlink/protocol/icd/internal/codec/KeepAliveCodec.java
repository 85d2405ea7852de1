package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.KeepAlive;
import com.questrail.radarlink.protocol.icd.model.MessageKind;

/**
 * Keep-alive payload: empty by definition, tolerant of padding.
 */
public final class KeepAliveCodec implements PayloadCodec<KeepAlive>
{
    @Override
    public MessageKind kind() {
        return MessageKind.KEEP_ALIVE;
    }

    @Override
    public Class<KeepAlive> messageType() {
        return KeepAlive.class;
    }

    @Override
    public KeepAlive decode(byte[] payload) {
        return payload.length == 0 ? KeepAlive.empty() : new KeepAlive(payload);
    }

    @Override
    public byte[] encode(KeepAlive message) {
        return message.extra();
    }
}
