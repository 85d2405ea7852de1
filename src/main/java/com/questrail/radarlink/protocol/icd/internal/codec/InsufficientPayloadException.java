package com.questrail.radarlink.protocol.icd.internal.codec;

/**
 * Raised by a payload codec when the payload is too short for its type.
 *
 * <p>This never reaches callers of the message decoder: the dispatcher turns
 * it into an {@code INSUFFICIENT_PAYLOAD} decode error carrying the header and
 * raw payload.</p>
 */
public final class InsufficientPayloadException extends Exception
{
    private final int required;
    private final int actual;

    public InsufficientPayloadException(String what, int required, int actual) {
        super(what + " requires at least " + required + " payload bytes, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }

    /**
     * Throws unless {@code payload} holds at least {@code required} bytes.
     */
    static void requireAtLeast(byte[] payload, int required, String what)
            throws InsufficientPayloadException
    {
        if (payload.length < required) {
            throw new InsufficientPayloadException(what, required, payload.length);
        }
    }
}
