package com.questrail.radarlink.protocol.icd.internal.events;

import java.time.Instant;

/**
 * ChannelEvent
 * -----------------------------------------------------------------------------
 * Availability changes of the byte stream to the radar controller.
 *
 * These events say nothing about protocol correctness; they only report that
 * the channel opened or was lost.
 */
public sealed interface ChannelEvent extends SessionEvent
        permits ChannelEvent.ChannelUp, ChannelEvent.ChannelDown
{
    /** Channel connected. */
    final class ChannelUp extends SessionEvent.Base implements ChannelEvent {
        public ChannelUp(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Channel closed or failed. */
    final class ChannelDown extends SessionEvent.Base implements ChannelEvent {
        public ChannelDown(Instant timestamp) {
            super(timestamp);
        }
    }
}
