package com.questrail.radarlink.protocol.icd.internal.exec;

import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;

/**
 * SessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure session reducer and the side-effecting
 * world of sockets and timers.
 *
 * <p>Implementations realize {@link SessionIntents}: they build and send
 * messages, and arm or cancel the heartbeat timer. They never decide protocol
 * behavior. Outcomes flow back to the reducer only as session events.</p>
 *
 * <p>Execution must be non-blocking and is invoked from a single thread at a
 * time.</p>
 */
public interface SessionIntentExecutor
{
    /**
     * Execute the supplied intents.
     *
     * @param intents immutable set of actions to perform
     */
    void execute(SessionIntents intents);
}
