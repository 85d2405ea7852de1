package com.questrail.radarlink.protocol.icd.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task handed to a {@link MonotonicScheduler}. The heartbeat timer
 * keeps one of these per armed tick.
 */
public interface Cancellable
{
    /**
     * Attempts to cancel the task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before.
     */
    boolean cancel();
}
