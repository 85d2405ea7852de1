package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.codec.impl.HeaderFieldOrder.HeaderField;
import com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * MessageHeaderCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the 20-byte message header using a {@link HeaderFieldOrder}.
 *
 * <p>This codec looks at the header only. It does not compare the declared
 * length with the bytes present; that comparison belongs to the message
 * decoder, which reports it as a warning.</p>
 */
public final class MessageHeaderCodec
{
    private final HeaderFieldOrder order;

    public MessageHeaderCodec(HeaderFieldOrder order) {
        this.order = Objects.requireNonNull(order, "order");
    }

    public HeaderFieldOrder order() {
        return order;
    }

    /**
     * Decodes the header at the start of {@code bytes}.
     *
     * @return the header, or {@link Optional#empty()} if fewer than 20 bytes are present
     */
    public Optional<MessageHeader> decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < MessageHeader.SIZE) {
            return Optional.empty();
        }

        ByteBuffer buf = LittleEndianBuffers.reader(bytes);
        return Optional.of(new MessageHeader(
                field(buf, 0, HeaderField.SOURCE_ID),
                field(buf, 0, HeaderField.MESSAGE_ID),
                field(buf, 0, HeaderField.MESSAGE_LENGTH),
                field(buf, 0, HeaderField.TIME_TAG),
                field(buf, 0, HeaderField.SEQUENCE_NUMBER)));
    }

    /**
     * Encodes {@code header} into exactly 20 bytes.
     */
    public byte[] encode(MessageHeader header) {
        Objects.requireNonNull(header, "header");

        ByteBuffer buf = LittleEndianBuffers.writer(MessageHeader.SIZE);
        LittleEndianBuffers.putU32(buf, order.offsetOf(HeaderField.SOURCE_ID), header.sourceId());
        LittleEndianBuffers.putU32(buf, order.offsetOf(HeaderField.MESSAGE_ID), header.messageId());
        LittleEndianBuffers.putU32(buf, order.offsetOf(HeaderField.MESSAGE_LENGTH), header.messageLength());
        LittleEndianBuffers.putU32(buf, order.offsetOf(HeaderField.TIME_TAG), header.timeTag());
        LittleEndianBuffers.putU32(buf, order.offsetOf(HeaderField.SEQUENCE_NUMBER), header.sequenceNumber());
        return buf.array();
    }

    /**
     * Reads only the declared message length of a header starting at
     * {@code offset}. The caller guarantees 20 bytes are available there.
     */
    long peekMessageLength(ByteBuffer buf, int offset) {
        return field(buf, offset, HeaderField.MESSAGE_LENGTH);
    }

    private long field(ByteBuffer buf, int base, HeaderField field) {
        return LittleEndianBuffers.getU32(buf, base + order.offsetOf(field));
    }
}
