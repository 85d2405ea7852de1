package com.questrail.radarlink.protocol.icd.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Runs tasks at monotonic deadlines.
 *
 * <p>Deadlines are expressed in {@link MonotonicClock} nanoseconds, never in
 * wall-clock instants, so the heartbeat cadence survives NTP steps and
 * midnight roll-over of the header time tag.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedules a task to run at or after the given deadline.
     *
     * @param deadlineNanos deadline from {@link MonotonicClock#nowNanos()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedules a task {@code delay} after the clock's current reading.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
