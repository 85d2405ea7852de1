package com.questrail.radarlink.protocol.icd.model;

/**
 * Sender-side header fields stamped onto an outbound message. Identifier and
 * length are supplied by the encoder.
 */
public record MessageStamp(long sourceId, long timeTag, long sequenceNumber)
{
    public MessageStamp {
        MessageHeader.requireU32(sourceId, "sourceId");
        MessageHeader.requireU32(timeTag, "timeTag");
        MessageHeader.requireU32(sequenceNumber, "sequenceNumber");
    }
}
