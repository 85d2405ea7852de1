package com.questrail.radarlink.protocol.icd.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for all session timing (heartbeat cadence).
 *
 * <p>Only differences between two readings are meaningful. Wall-clock time is
 * reserved for header time tags and observability; see {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a non-decreasing tick value in nanoseconds.
     */
    long nowNanos();
}
