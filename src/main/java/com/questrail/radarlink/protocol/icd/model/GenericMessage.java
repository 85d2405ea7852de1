package com.questrail.radarlink.protocol.icd.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Message whose identifier has no structured decoder.
 *
 * <p>
 * The payload is preserved byte-for-byte so that callers can log it or hand it
 * to a decoder of their own. Producing a {@code GenericMessage} is never an
 * error.
 * </p>
 */
public record GenericMessage(long messageId, byte[] payload) implements RadarMessage
{
    public GenericMessage {
        MessageHeader.requireU32(messageId, "messageId");
        Objects.requireNonNull(payload, "payload");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GenericMessage other
                && messageId == other.messageId
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(messageId) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return String.format("GenericMessage[id=0x%08X, payload=%d bytes]", messageId, payload.length);
    }
}
