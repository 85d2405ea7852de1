package com.questrail.radarlink.protocol.icd.internal.state;

import com.questrail.radarlink.protocol.icd.model.SystemStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkSessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one link session.
 *
 * <h2>Role in the architecture</h2>
 * Consumed and produced by {@link SessionReducer}. It holds only facts that
 * drive protocol decisions:
 * <ul>
 *   <li>the current {@link LinkPhase}</li>
 *   <li>how many status reports arrived since the channel came up</li>
 *   <li>how many data messages (targets, motion, sensor position) arrived</li>
 *   <li>the most recent decoded status report</li>
 * </ul>
 *
 * Counters are cleared whenever the channel comes up or goes down.
 */
public final class LinkSessionState
{
    private final LinkPhase phase;
    private final long statusCount;
    private final long dataMessageCount;
    private final SystemStatus lastStatus;
    private final Instant lastTransition;

    private LinkSessionState(LinkPhase phase,
                             long statusCount,
                             long dataMessageCount,
                             SystemStatus lastStatus,
                             Instant lastTransition) {
        this.phase = Objects.requireNonNull(phase, "phase");
        if (statusCount < 0 || dataMessageCount < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
        this.statusCount = statusCount;
        this.dataMessageCount = dataMessageCount;
        this.lastStatus = lastStatus;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public LinkPhase phase() {
        return phase;
    }

    /**
     * Status reports seen since the channel came up, including reports whose
     * payload was too short to decode.
     */
    public long statusCount() {
        return statusCount;
    }

    public long dataMessageCount() {
        return dataMessageCount;
    }

    public Optional<SystemStatus> lastStatus() {
        return Optional.ofNullable(lastStatus);
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * Initial state: no channel, counters zero.
     */
    public static LinkSessionState disconnected(Instant now) {
        return new LinkSessionState(LinkPhase.DISCONNECTED, 0, 0, null, now);
    }

    /**
     * Returns a state in the given phase with all counters cleared.
     */
    public LinkSessionState reset(LinkPhase phase, Instant now) {
        return new LinkSessionState(phase, 0, 0, null, now);
    }

    /**
     * Returns a new state in the given phase. The transition time moves only
     * when the phase actually changes.
     */
    public LinkSessionState withPhase(LinkPhase newPhase, Instant now) {
        if (newPhase == phase) {
            return this;
        }
        return new LinkSessionState(newPhase, statusCount, dataMessageCount, lastStatus, now);
    }

    public LinkSessionState withStatusCount(long count) {
        return new LinkSessionState(phase, count, dataMessageCount, lastStatus, lastTransition);
    }

    public LinkSessionState withDataMessageCount(long count) {
        return new LinkSessionState(phase, statusCount, count, lastStatus, lastTransition);
    }

    public LinkSessionState withLastStatus(SystemStatus status) {
        return new LinkSessionState(phase, statusCount, dataMessageCount,
                Objects.requireNonNull(status, "status"), lastTransition);
    }

    @Override
    public String toString() {
        return "LinkSessionState[" + phase
                + ", statusCount=" + statusCount
                + ", dataMessageCount=" + dataMessageCount
                + "]";
    }
}
