package com.questrail.radarlink.protocol.icd.runtime;

import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageHeaderCodec;
import com.questrail.radarlink.protocol.icd.codec.impl.OutboundMessageFactory;
import com.questrail.radarlink.protocol.icd.config.RadarLinkConfig;
import com.questrail.radarlink.protocol.icd.config.SessionPolicy;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.state.LinkPhase;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.time.SystemWallClock;
import com.questrail.radarlink.protocol.icd.model.*;
import com.questrail.radarlink.protocol.icd.observability.RecordingObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionTransitionEvent;
import com.questrail.radarlink.protocol.icd.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RadarLinkRuntimeSmokeTest
 * -----------------------------------------------------------------------------
 * The composed runtime on real threads, with the socket swapped for a fake.
 */
class RadarLinkRuntimeSmokeTest {

    private RadarLinkRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void runtimeConnectsRequestsStandbyAndDeliversMessages() throws Exception {
        RadarLinkConfig config = RadarLinkConfig.builder()
                .withRemoteAddress(new InetSocketAddress("127.0.0.1", 50_000))
                .withSessionPolicy(new SessionPolicy(2, 6, 3, Duration.ofMillis(50)))
                .build();

        FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        List<DecodedMessage> delivered = new CopyOnWriteArrayList<>();
        List<LinkSessionState> states = new CopyOnWriteArrayList<>();

        runtime = RadarLinkRuntime.builder()
                .withConfig(config)
                .withEndpoint(endpoint)
                .withObservabilitySink(sink)
                .withMessageListener(delivered::add)
                .withStatusCallback(states::add)
                .withZone(ZoneOffset.UTC)
                .build();

        assertEquals(LinkPhase.DISCONNECTED, runtime.currentState().phase());
        runtime.start();
        await(() -> runtime.currentState().phase() == LinkPhase.CONNECTED);

        MessageHeaderCodec headerCodec = new MessageHeaderCodec(config.revision().headerOrder());
        MessageRegistry registry = MessageRegistry.standard(config.catalog(), config.revision().controlLayout());
        OutboundMessageFactory radar = new OutboundMessageFactory(
                new DefaultRadarMessageEncoder(headerCodec, registry), 0x2000, SystemWallClock.INSTANCE, ZoneOffset.UTC);
        DefaultRadarMessageDecoder decoder = new DefaultRadarMessageDecoder(headerCodec, registry);

        endpoint.injectBytes(radar.build(SystemStatus.basic(RadarStatusState.IDLE.code(), 0, 0)));
        endpoint.injectBytes(radar.build(SystemStatus.basic(RadarStatusState.IDLE.code(), 0, 0)));

        await(() -> runtime.currentState().phase() == LinkPhase.STANDBY_REQUESTED);
        await(() -> endpoint.sent().stream()
                .map(b -> ((DecodeResult.Decoded) decoder.decode(b)).message().body())
                .anyMatch(body -> body instanceof SystemControl));

        // Heartbeat keeps running on its own thread.
        await(() -> endpoint.sent().stream()
                .map(b -> ((DecodeResult.Decoded) decoder.decode(b)).message().body())
                .filter(body -> body instanceof KeepAlive)
                .count() >= 3);

        assertEquals(2, delivered.size());
        assertFalse(states.isEmpty());
        assertTrue(sink.getStateTransitions().stream().anyMatch(SessionTransitionEvent::isPhaseChange));
    }

    @Test
    void buildRequiresConfig() {
        assertThrows(NullPointerException.class, () -> RadarLinkRuntime.builder().build());
    }
}
