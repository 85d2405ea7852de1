package com.questrail.radarlink.protocol.icd.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for all internal events processed by the link session
 * state machine.
 *
 * <h2>Role in the architecture</h2>
 * The session is modeled as an event-driven, single-writer system. All changes
 * to session state occur in response to {@link SessionEvent}s that are
 * serialized and processed one at a time:
 * <ul>
 *   <li>channel lifecycle changes</li>
 *   <li>decoded messages and decode failures from the wire</li>
 *   <li>heartbeat ticks</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance state.
 */
public interface SessionEvent
{
    /**
     * Time at which the event occurred or was generated. Used for tracing and
     * as the transition time of the resulting state.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SessionEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
