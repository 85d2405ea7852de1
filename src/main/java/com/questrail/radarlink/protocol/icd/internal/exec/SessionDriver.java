package com.questrail.radarlink.protocol.icd.internal.exec;

import com.questrail.radarlink.protocol.icd.internal.events.MessageEvent;
import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionReducer;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.observability.DecodeFailureEvent;
import com.questrail.radarlink.protocol.icd.observability.HeaderWarningEvent;
import com.questrail.radarlink.protocol.icd.observability.NullSessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionErrorEvent;
import com.questrail.radarlink.protocol.icd.observability.SessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionTransitionEvent;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * SessionDriver
 * =============================================================================
 * Runs the link session on a dedicated thread.
 *
 * <h2>Purpose</h2>
 * Events from the transport (Netty event loop) and from the heartbeat timer
 * (scheduler thread) arrive concurrently. The driver serializes them through
 * a queue so that the reducer sees one event at a time and the executor is
 * never re-entered.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → starts the event loop thread
 *   driver.submitEvent(...)  → enqueues an event (dropped when not running)
 *   driver.stop()            → stops the thread, waiting up to 5s
 * </pre>
 *
 * <h2>Failure handling</h2>
 * An exception thrown while processing one event is reported to the
 * observability sink and the loop continues with the next event.
 */
public final class SessionDriver {

    private final SessionReducer reducer;
    private final SessionIntentExecutor executor;
    private final Supplier<LinkSessionState> initialStateSupplier;
    private final SessionObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final BlockingQueue<SessionEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile LinkSessionState currentState;
    private volatile Thread eventLoopThread;

    /**
     * @param observabilitySink may be {@code null}, in which case events are discarded
     */
    public SessionDriver(SessionReducer reducer,
                         SessionIntentExecutor executor,
                         Supplier<LinkSessionState> initialStateSupplier,
                         SessionObservabilitySink observabilitySink,
                         WallClock wallClock)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.initialStateSupplier = Objects.requireNonNull(initialStateSupplier, "initialStateSupplier");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullSessionObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.currentState = initialStateSupplier.get();
    }

    /**
     * Starts the event loop thread. Idempotent while running.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            synchronized (stateLock) {
                currentState = initialStateSupplier.get();
            }
            eventQueue.clear();
            eventLoopThread = new Thread(this::runEventLoop, "radarlink-session-driver");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread and waits for it to finish. Events still
     * queued are discarded.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Enqueues an event. Safe to call from any thread.
     */
    public void submitEvent(SessionEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    public LinkSessionState currentState() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                SessionEvent event = eventQueue.take();
                if (running.get()) {
                    processEvent(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (Exception e) {
                observabilitySink.onError(new SessionErrorEvent(
                    wallClock.now(),
                    "Session event processing error",
                    e
                ));
            }
        }
    }

    private void processEvent(SessionEvent event) {
        final LinkSessionState oldState;
        final SessionReducer.Result result;

        synchronized (stateLock) {
            oldState = currentState;
            result = reducer.apply(currentState, event);
            currentState = result.newState();
        }

        if (event instanceof MessageEvent.DecodeFailed failed) {
            observabilitySink.onDecodeFailure(new DecodeFailureEvent(event.timestamp(), failed.error()));
        } else if (event instanceof MessageEvent.MessageReceived received && received.message().hasWarnings()) {
            observabilitySink.onHeaderWarning(new HeaderWarningEvent(event.timestamp(), received.message()));
        }

        observabilitySink.onStateTransition(new SessionTransitionEvent(
            wallClock.now(),
            oldState,
            result.newState(),
            event,
            result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }
}
