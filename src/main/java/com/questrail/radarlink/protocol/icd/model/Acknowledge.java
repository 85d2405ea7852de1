package com.questrail.radarlink.protocol.icd.model;

/**
 * Acknowledge.
 *
 * <p>
 * Sent by the C2 after every third status report. The payload is the sequence
 * number of the status message being acknowledged.
 * </p>
 */
public record Acknowledge(long acknowledgedSequence) implements RadarMessage
{
    public Acknowledge {
        MessageHeader.requireU32(acknowledgedSequence, "acknowledgedSequence");
    }
}
