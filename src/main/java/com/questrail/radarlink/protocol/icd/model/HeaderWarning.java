package com.questrail.radarlink.protocol.icd.model;

/**
 * Non-fatal inconsistencies between a header's declared length and the bytes
 * actually handed to the decoder.
 */
public enum HeaderWarning
{
    /** The header declares more bytes than were present. */
    DECLARED_LENGTH_EXCEEDS_DATA,

    /** More bytes were present than the header declares. */
    DATA_EXCEEDS_DECLARED_LENGTH
}
