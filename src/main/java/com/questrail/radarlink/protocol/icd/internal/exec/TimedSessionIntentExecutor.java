package com.questrail.radarlink.protocol.icd.internal.exec;

import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.events.TimerEvent;
import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;
import com.questrail.radarlink.protocol.icd.internal.time.Cancellable;
import com.questrail.radarlink.protocol.icd.internal.time.MonotonicClock;
import com.questrail.radarlink.protocol.icd.internal.time.MonotonicScheduler;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * TimedSessionIntentExecutor
 * =============================================================================
 * Wraps a {@link SessionIntentExecutor} and owns the heartbeat timer.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@code STOP_HEARTBEAT} cancels the armed tick before the delegate runs.</li>
 *   <li>{@code START_HEARTBEAT} arms a periodic tick after the delegate runs;
 *       each tick injects a {@link TimerEvent.HeartbeatDue} event and re-arms
 *       itself one interval after the previous deadline, so the cadence does
 *       not drift with processing time.</li>
 *   <li>All other intents pass through to the delegate.</li>
 * </ul>
 *
 * <p>The executor never sends keep-alives itself. The reducer turns each tick
 * into a {@code SEND_KEEP_ALIVE} intent, which keeps the decision (for example
 * "not while disconnected") in one place.</p>
 *
 * <p>Every arm increments a generation number. A tick whose generation is no
 * longer current does nothing, which covers a cancel racing with a tick that
 * is already running.</p>
 */
public final class TimedSessionIntentExecutor implements SessionIntentExecutor {

    private final SessionIntentExecutor delegate;
    private final Consumer<SessionEvent> eventSink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final Duration heartbeatInterval;

    private final Object timerLock = new Object();
    private final AtomicLong generation = new AtomicLong(0);
    private volatile Cancellable armedTick = null;

    public TimedSessionIntentExecutor(SessionIntentExecutor delegate,
                                      Consumer<SessionEvent> eventSink,
                                      MonotonicClock clock,
                                      MonotonicScheduler scheduler,
                                      WallClock wallClock,
                                      Duration heartbeatInterval)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
    }

    @Override
    public void execute(SessionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        if (intents.contains(SessionIntents.Kind.STOP_HEARTBEAT)) {
            cancelHeartbeat();
        }

        delegate.execute(intents);

        if (intents.contains(SessionIntents.Kind.START_HEARTBEAT)) {
            armHeartbeat();
        }
    }

    /**
     * Returns {@code true} while a heartbeat tick is armed.
     */
    public boolean heartbeatArmed() {
        return armedTick != null;
    }

    /**
     * Cancels the heartbeat, if armed. Also used by the runtime on shutdown.
     */
    public void cancelHeartbeat() {
        synchronized (timerLock) {
            generation.incrementAndGet();
            Cancellable prior = armedTick;
            armedTick = null;
            if (prior != null) {
                prior.cancel();
            }
        }
    }

    private void armHeartbeat()
    {
        synchronized (timerLock) {
            cancelHeartbeat();
            long gen = generation.get();
            schedule(gen, clock.nowNanos() + heartbeatInterval.toNanos());
        }
    }

    private void schedule(long gen, long deadlineNanos)
    {
        armedTick = scheduler.scheduleAtNanos(deadlineNanos, () -> onTick(gen, deadlineNanos));
    }

    private void onTick(long gen, long deadlineNanos)
    {
        synchronized (timerLock) {
            // Stale guard: cancelled or re-armed since this tick was scheduled.
            if (gen != generation.get()) {
                return;
            }
            schedule(gen, deadlineNanos + heartbeatInterval.toNanos());
        }

        eventSink.accept(new TimerEvent.HeartbeatDue(wallClock.now()));
    }
}
