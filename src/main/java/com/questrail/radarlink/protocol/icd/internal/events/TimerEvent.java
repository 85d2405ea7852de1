package com.questrail.radarlink.protocol.icd.internal.events;

import java.time.Instant;

/**
 * TimerEvent
 * -----------------------------------------------------------------------------
 * Events produced by the executor's timers rather than by the wire.
 */
public sealed interface TimerEvent extends SessionEvent
        permits TimerEvent.HeartbeatDue
{
    /** The keep-alive interval elapsed. */
    final class HeartbeatDue extends SessionEvent.Base implements TimerEvent {
        public HeartbeatDue(Instant timestamp) {
            super(timestamp);
        }
    }
}
