package com.questrail.radarlink.protocol.icd.codec.impl;

import java.util.EnumSet;
import java.util.List;

/**
 * HeaderFieldOrder
 * -----------------------------------------------------------------------------
 * Named strategy for the order of the five u32 fields in the 20-byte header.
 *
 * <p>Two orders exist in the field:</p>
 * <ul>
 *   <li>{@link #SOURCE_FIRST}: {@code sourceId, messageId, messageLength,
 *       timeTag, sequenceNumber}. This is what deployed radar controllers
 *       send and is the default.</li>
 *   <li>{@link #SOURCE_LAST}: {@code messageId, messageLength, timeTag,
 *       sequenceNumber, sourceId}, as written by a later revision of the
 *       interface description.</li>
 * </ul>
 *
 * <p>The order is selected per link through the protocol revision. Nothing
 * outside the header codec and the stream framer needs to know which one is
 * in force.</p>
 */
public enum HeaderFieldOrder
{
    SOURCE_FIRST(HeaderField.SOURCE_ID, HeaderField.MESSAGE_ID, HeaderField.MESSAGE_LENGTH,
            HeaderField.TIME_TAG, HeaderField.SEQUENCE_NUMBER),

    SOURCE_LAST(HeaderField.MESSAGE_ID, HeaderField.MESSAGE_LENGTH, HeaderField.TIME_TAG,
            HeaderField.SEQUENCE_NUMBER, HeaderField.SOURCE_ID);

    /** The logical header fields. */
    public enum HeaderField {
        SOURCE_ID,
        MESSAGE_ID,
        MESSAGE_LENGTH,
        TIME_TAG,
        SEQUENCE_NUMBER
    }

    private static final int FIELD_SIZE = 4;

    private final List<HeaderField> fields;

    HeaderFieldOrder(HeaderField... fields) {
        if (fields.length != HeaderField.values().length
                || !EnumSet.copyOf(List.of(fields)).equals(EnumSet.allOf(HeaderField.class))) {
            throw new IllegalArgumentException("Header order must list every field exactly once");
        }
        this.fields = List.of(fields);
    }

    /**
     * Byte offset of {@code field} within the header.
     */
    public int offsetOf(HeaderField field) {
        return fields.indexOf(field) * FIELD_SIZE;
    }

    /**
     * Fields in wire order.
     */
    public List<HeaderField> fields() {
        return fields;
    }
}
