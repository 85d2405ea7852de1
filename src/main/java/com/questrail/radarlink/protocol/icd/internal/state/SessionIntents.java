package com.questrail.radarlink.protocol.icd.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable collection of actions requested by the {@link SessionReducer}.
 *
 * The reducer decides <b>what</b> should happen; an executor decides
 * <b>how</b>: which bytes to build, which timer to arm. No intent performs
 * I/O directly.
 */
public final class SessionIntents
{
    /**
     * Actions the session may request.
     */
    public enum Kind {
        /** Arm the periodic keep-alive timer. */
        START_HEARTBEAT,

        /** Cancel the keep-alive timer. */
        STOP_HEARTBEAT,

        /** Send one keep-alive message now. */
        SEND_KEEP_ALIVE,

        /** Send a system control carrying the standby control code. */
        REQUEST_STANDBY,

        /** Send a system control carrying the operate control code. */
        REQUEST_OPERATE,

        /** Acknowledge a status report by its sequence number. */
        SEND_ACKNOWLEDGE
    }

    private static final SessionIntents NONE = new SessionIntents(EnumSet.noneOf(Kind.class), null);

    private final Set<Kind> kinds;
    private final Long acknowledgeSequence;

    private SessionIntents(Set<Kind> kinds, Long acknowledgeSequence) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty()
                ? EnumSet.noneOf(Kind.class)
                : EnumSet.copyOf(kinds));
        if (this.kinds.contains(Kind.SEND_ACKNOWLEDGE) && acknowledgeSequence == null) {
            throw new IllegalArgumentException("SEND_ACKNOWLEDGE requires a sequence number");
        }
        this.acknowledgeSequence = acknowledgeSequence;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * Sequence number to acknowledge, present when {@link Kind#SEND_ACKNOWLEDGE}
     * is requested.
     */
    public OptionalLong acknowledgeSequence() {
        return acknowledgeSequence == null ? OptionalLong.empty() : OptionalLong.of(acknowledgeSequence);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private Long acknowledgeSequence;

        private Builder() {}

        public Builder add(Kind kind) {
            Objects.requireNonNull(kind, "kind");
            kinds.add(kind);
            return this;
        }

        public Builder acknowledge(long sequenceNumber) {
            kinds.add(Kind.SEND_ACKNOWLEDGE);
            this.acknowledgeSequence = sequenceNumber;
            return this;
        }

        public SessionIntents build() {
            return new SessionIntents(kinds, acknowledgeSequence);
        }
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static SessionIntents none() {
        return NONE;
    }

    public static SessionIntents startHeartbeat() {
        return new SessionIntents(EnumSet.of(Kind.START_HEARTBEAT), null);
    }

    public static SessionIntents stopHeartbeat() {
        return new SessionIntents(EnumSet.of(Kind.STOP_HEARTBEAT), null);
    }

    public static SessionIntents sendKeepAlive() {
        return new SessionIntents(EnumSet.of(Kind.SEND_KEEP_ALIVE), null);
    }

    public static SessionIntents requestStandby() {
        return new SessionIntents(EnumSet.of(Kind.REQUEST_STANDBY), null);
    }

    public static SessionIntents requestOperate() {
        return new SessionIntents(EnumSet.of(Kind.REQUEST_OPERATE), null);
    }

    public static SessionIntents sendAcknowledge(long sequenceNumber) {
        return new SessionIntents(EnumSet.of(Kind.SEND_ACKNOWLEDGE), sequenceNumber);
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Combines two intent sets. Both may carry an acknowledgement only if they
     * acknowledge the same sequence number.
     */
    public SessionIntents and(SessionIntents other) {
        Objects.requireNonNull(other, "other");

        Long ack = this.acknowledgeSequence;
        if (ack != null && other.acknowledgeSequence != null
                && !ack.equals(other.acknowledgeSequence)) {
            throw new IllegalArgumentException(
                    "Cannot combine acknowledgements of different sequence numbers");
        }
        if (ack == null) {
            ack = other.acknowledgeSequence;
        }

        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);
        return new SessionIntents(merged, ack);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionIntents other)) return false;
        return kinds.equals(other.kinds) && Objects.equals(acknowledgeSequence, other.acknowledgeSequence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinds, acknowledgeSequence);
    }

    @Override
    public String toString() {
        return "SessionIntents" + kinds
                + (acknowledgeSequence != null ? "(ack=" + acknowledgeSequence + ")" : "");
    }
}
