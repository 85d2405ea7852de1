package com.questrail.radarlink.protocol.icd.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DecodeError
 * -----------------------------------------------------------------------------
 * Value describing why bytes could not be turned into a {@link RadarMessage}.
 *
 * <p>Errors are returned, never thrown. The offending bytes are kept so that
 * callers can log or archive them, and, where the header was readable, the
 * header and the catalog kind it resolved to travel with the error. The
 * session state machine relies on the latter to count a short status report
 * as a status report.</p>
 */
public final class DecodeError
{
    private final DecodeErrorKind kind;
    private final MessageHeader header;
    private final MessageKind messageKind;
    private final byte[] raw;
    private final String reason;

    private DecodeError(DecodeErrorKind kind,
                        MessageHeader header,
                        MessageKind messageKind,
                        byte[] raw,
                        String reason)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.header = header;
        this.messageKind = messageKind;
        this.raw = Objects.requireNonNull(raw, "raw").clone();
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static DecodeError tooShort(byte[] raw) {
        return new DecodeError(DecodeErrorKind.TOO_SHORT, null, null, raw,
                "Message of " + raw.length + " bytes is shorter than the " + MessageHeader.SIZE + "-byte header");
    }

    public static DecodeError insufficientPayload(MessageHeader header,
                                                  MessageKind messageKind,
                                                  byte[] payload,
                                                  String reason)
    {
        return new DecodeError(DecodeErrorKind.INSUFFICIENT_PAYLOAD,
                Objects.requireNonNull(header, "header"),
                Objects.requireNonNull(messageKind, "messageKind"),
                payload, reason);
    }

    public static DecodeError framingDesync(long declaredLength, byte[] discarded) {
        return new DecodeError(DecodeErrorKind.FRAMING_DESYNC, null, null, discarded,
                "Implausible declared length " + declaredLength + "; discarded " + discarded.length + " byte(s)");
    }

    public DecodeErrorKind kind() {
        return kind;
    }

    public Optional<MessageHeader> header() {
        return Optional.ofNullable(header);
    }

    /**
     * Kind the header's identifier resolved to, when the header was readable
     * and the identifier is catalogued.
     */
    public Optional<MessageKind> messageKind() {
        return Optional.ofNullable(messageKind);
    }

    /**
     * The bytes that could not be decoded. For {@link DecodeErrorKind#INSUFFICIENT_PAYLOAD}
     * this is the payload only (header excluded).
     */
    public byte[] raw() {
        return raw.clone();
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodeError other)) return false;
        return kind == other.kind
                && Objects.equals(header, other.header)
                && messageKind == other.messageKind
                && Arrays.equals(raw, other.raw)
                && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, header, messageKind, Arrays.hashCode(raw), reason);
    }

    @Override
    public String toString() {
        return "DecodeError[" + kind + ", " + reason
                + (header != null ? ", " + header : "")
                + "]";
    }
}
