package com.questrail.radarlink.protocol.icd.model;

/**
 * Classification of decode failures.
 *
 * <p>An unknown message identifier is deliberately absent: it decodes as a
 * {@link GenericMessage} and is not a failure.</p>
 */
public enum DecodeErrorKind
{
    /** Fewer than 20 bytes were supplied; no header could be read. */
    TOO_SHORT,

    /** The header was read but the payload is shorter than its type requires. */
    INSUFFICIENT_PAYLOAD,

    /** The stream framer met an impossible declared length and skipped a byte. */
    FRAMING_DESYNC
}
