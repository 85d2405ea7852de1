package com.questrail.radarlink.protocol.icd.model;

import java.time.LocalTime;

/**
 * MessageHeader
 * -----------------------------------------------------------------------------
 * The fixed 20-byte header that prefixes every ICD message on the link.
 *
 * <p>All five fields are unsigned 32-bit values on the wire. They are carried
 * here as {@code long} so the full unsigned range is representable; the
 * canonical constructor rejects anything outside {@code 0..0xFFFFFFFF}.</p>
 *
 * <p>The order in which the fields appear on the wire is <em>not</em> a
 * property of this type. It belongs to the header codec's field-order
 * strategy, because different protocol revisions disagree on it.</p>
 *
 * @param sourceId       identifier of the sending node
 * @param messageId      message type identifier (see {@link MessageKind})
 * @param messageLength  declared total length in bytes, header included
 * @param timeTag        milliseconds since local midnight at the sender
 * @param sequenceNumber per-sender sequence number
 */
public record MessageHeader(
        long sourceId,
        long messageId,
        long messageLength,
        long timeTag,
        long sequenceNumber
) {
    /** Encoded header size in bytes. */
    public static final int SIZE = 20;

    /** Largest value an unsigned 32-bit header field may hold. */
    public static final long U32_MAX = 0xFFFF_FFFFL;

    private static final long MILLIS_PER_DAY = 86_400_000L;

    public MessageHeader {
        requireU32(sourceId, "sourceId");
        requireU32(messageId, "messageId");
        requireU32(messageLength, "messageLength");
        requireU32(timeTag, "timeTag");
        requireU32(sequenceNumber, "sequenceNumber");
    }

    /**
     * Convenience factory computing {@code messageLength} from a payload size.
     */
    public static MessageHeader forPayload(long sourceId,
                                           long messageId,
                                           int payloadLength,
                                           long timeTag,
                                           long sequenceNumber)
    {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("payloadLength must be >= 0");
        }
        return new MessageHeader(sourceId, messageId, SIZE + (long) payloadLength, timeTag, sequenceNumber);
    }

    /**
     * Payload size implied by the declared length. Negative when the sender
     * declared a length shorter than the header itself.
     */
    public long declaredPayloadLength() {
        return messageLength - SIZE;
    }

    /**
     * Interprets the time tag as a time of day. Tags beyond one day wrap.
     */
    public LocalTime timeOfDay() {
        return LocalTime.ofNanoOfDay((timeTag % MILLIS_PER_DAY) * 1_000_000L);
    }

    @Override
    public String toString() {
        return String.format("MessageHeader[source=0x%X, id=0x%08X, length=%d, time=%d, seq=%d]",
                sourceId, messageId, messageLength, timeTag, sequenceNumber);
    }

    static void requireU32(long value, String name) {
        if (value < 0 || value > U32_MAX) {
            throw new IllegalArgumentException(name + " out of u32 range: " + value);
        }
    }
}
