package com.questrail.radarlink.protocol.icd.observability;

import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;

import java.time.Instant;

/**
 * One reducer step: the state before and after, what caused it, and what it asked for.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    LinkSessionState oldState,
    LinkSessionState newState,
    SessionEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }
}
