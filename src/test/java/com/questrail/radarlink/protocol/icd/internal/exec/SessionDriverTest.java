package com.questrail.radarlink.protocol.icd.internal.exec;

import com.questrail.radarlink.protocol.icd.config.ProtocolRevision;
import com.questrail.radarlink.protocol.icd.config.SessionPolicy;
import com.questrail.radarlink.protocol.icd.internal.events.ChannelEvent;
import com.questrail.radarlink.protocol.icd.internal.events.MessageEvent;
import com.questrail.radarlink.protocol.icd.internal.state.LinkPhase;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;
import com.questrail.radarlink.protocol.icd.internal.state.SessionReducer;
import com.questrail.radarlink.protocol.icd.internal.time.SystemWallClock;
import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.observability.DecodeFailureEvent;
import com.questrail.radarlink.protocol.icd.observability.RecordingObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionErrorEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionDriverTest
 * -----------------------------------------------------------------------------
 * The threaded driver serializes events from any thread onto its own loop.
 */
class SessionDriverTest {

    private SessionReducer reducer;
    private RecordingObservabilitySink sink;
    private SessionDriver driver;

    @BeforeEach
    void setUp() {
        reducer = new SessionReducer(SessionPolicy.defaults(), ProtocolRevision.icd());
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.stop();
        }
    }

    private SessionDriver driver(SessionIntentExecutor executor) {
        return new SessionDriver(reducer, executor,
                () -> LinkSessionState.disconnected(Instant.EPOCH), sink, SystemWallClock.INSTANCE);
    }

    @Test
    void eventsAreProcessedOnDriverThread() throws Exception {
        CountDownLatch executed = new CountDownLatch(1);
        List<String> threads = new CopyOnWriteArrayList<>();
        List<SessionIntents> seen = new CopyOnWriteArrayList<>();

        driver = driver(intents -> {
            threads.add(Thread.currentThread().getName());
            seen.add(intents);
            executed.countDown();
        });
        driver.start();
        assertTrue(driver.isRunning());

        driver.submitEvent(new ChannelEvent.ChannelUp(Instant.now()));

        assertTrue(executed.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("radarlink-session-driver"), threads);
        assertTrue(seen.get(0).contains(SessionIntents.Kind.START_HEARTBEAT));
        assertEquals(LinkPhase.CONNECTED, driver.currentState().phase());
        assertEquals(1, sink.getStateTransitions().size());
    }

    @Test
    void eventsSubmittedBeforeStartAreDropped() throws Exception {
        driver = driver(intents -> { });
        driver.submitEvent(new ChannelEvent.ChannelUp(Instant.now()));
        driver.start();

        driver.submitEvent(new MessageEvent.DecodeFailed(Instant.now(), DecodeError.tooShort(new byte[1])));
        waitUntil(() -> sink.hasEventOfType(DecodeFailureEvent.class));

        assertEquals(LinkPhase.DISCONNECTED, driver.currentState().phase());
    }

    @Test
    void executorFailureIsReportedAndLoopContinues() throws Exception {
        CountDownLatch calls = new CountDownLatch(2);
        driver = driver(intents -> {
            calls.countDown();
            throw new IllegalStateException("boom");
        });
        driver.start();

        driver.submitEvent(new ChannelEvent.ChannelUp(Instant.now()));
        driver.submitEvent(new ChannelEvent.ChannelDown(Instant.now()));

        assertTrue(calls.await(2, TimeUnit.SECONDS));
        waitUntil(() -> sink.eventsOfType(SessionErrorEvent.class).size() == 2);
        assertEquals(LinkPhase.DISCONNECTED, driver.currentState().phase());
    }

    @Test
    void stopEndsTheLoop() {
        driver = driver(intents -> { });
        driver.start();
        driver.stop();

        assertFalse(driver.isRunning());
        driver.submitEvent(new ChannelEvent.ChannelUp(Instant.now()));
        assertEquals(LinkPhase.DISCONNECTED, driver.currentState().phase());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 2s");
            }
            Thread.sleep(10);
        }
    }
}
