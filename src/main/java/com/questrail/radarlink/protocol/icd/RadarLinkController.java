package com.questrail.radarlink.protocol.icd;

import com.questrail.radarlink.protocol.icd.internal.events.MessageEvent;
import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.exec.SessionIntentExecutor;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionReducer;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.observability.DecodeFailureEvent;
import com.questrail.radarlink.protocol.icd.observability.HeaderWarningEvent;
import com.questrail.radarlink.protocol.icd.observability.NullSessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionTransitionEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * RadarLinkController
 * -----------------------------------------------------------------------------
 * Synchronous owner of one link session, for hosts that already provide a
 * single-threaded loop (a Netty event loop, a test).
 *
 * <h2>Execution model</h2>
 * <pre>
 *   submit(event) … drain()
 *       event → reducer → new state → intents → executor
 * </pre>
 * No blocking or scheduling happens here. The caller drives the loop with
 * {@link #step()} or {@link #drain()} and must do so from one thread at a
 * time. For a dedicated thread, use
 * {@link com.questrail.radarlink.protocol.icd.internal.exec.SessionDriver}.
 *
 * <p>Events submitted by the executor while a step runs (a heartbeat fired
 * synchronously by a test scheduler, say) are queued and handled by the same
 * drain.</p>
 */
public class RadarLinkController
{
    private final SessionReducer reducer;
    private final SessionIntentExecutor executor;
    private final SessionObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Deque<SessionEvent> queue = new ArrayDeque<>();

    // Volatile for cross-thread observation only; no other thread-safety is offered.
    private volatile LinkSessionState state;

    public RadarLinkController(LinkSessionState initialState,
                               SessionReducer reducer,
                               SessionIntentExecutor executor,
                               SessionObservabilitySink observabilitySink,
                               WallClock wallClock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullSessionObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public RadarLinkController(LinkSessionState initialState,
                               SessionReducer reducer,
                               SessionIntentExecutor executor,
                               WallClock wallClock)
    {
        this(initialState, reducer, executor, null, wallClock);
    }

    /**
     * Enqueue an event for later processing.
     */
    public void submit(SessionEvent event)
    {
        Objects.requireNonNull(event, "event");
        queue.addLast(event);
    }

    /**
     * Process exactly one queued event, if present.
     *
     * @return {@code true} if an event was processed; {@code false} if the queue was empty
     */
    public boolean step()
    {
        SessionEvent event = queue.pollFirst();
        if (event == null) {
            return false;
        }

        LinkSessionState oldState = state;
        SessionReducer.Result result = reducer.apply(oldState, event);
        this.state = result.newState();

        if (event instanceof MessageEvent.DecodeFailed failed) {
            observabilitySink.onDecodeFailure(new DecodeFailureEvent(event.timestamp(), failed.error()));
        } else if (event instanceof MessageEvent.MessageReceived received && received.message().hasWarnings()) {
            observabilitySink.onHeaderWarning(new HeaderWarningEvent(event.timestamp(), received.message()));
        }
        observabilitySink.onStateTransition(new SessionTransitionEvent(
                wallClock.now(), oldState, result.newState(), event, result.intents()));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }

        return true;
    }

    /**
     * Drain the queue until no events remain.
     */
    public void drain()
    {
        while (step()) {
            // Intentionally empty.
        }
    }

    /**
     * Submit and drain in one call.
     */
    public void accept(SessionEvent event)
    {
        submit(event);
        drain();
    }

    public LinkSessionState state()
    {
        return state;
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    public Optional<SessionEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peekFirst());
    }
}
