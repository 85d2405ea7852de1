package com.questrail.radarlink.protocol.icd.transport.tcp;

import com.questrail.radarlink.protocol.icd.RadarLinkController;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.codec.impl.HeaderFieldOrder;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageHeaderCodec;
import com.questrail.radarlink.protocol.icd.codec.impl.OutboundMessageFactory;
import com.questrail.radarlink.protocol.icd.config.ControlParameters;
import com.questrail.radarlink.protocol.icd.config.ProtocolRevision;
import com.questrail.radarlink.protocol.icd.config.SessionPolicy;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.exec.TimedSessionIntentExecutor;
import com.questrail.radarlink.protocol.icd.internal.state.LinkPhase;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionReducer;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.model.*;
import com.questrail.radarlink.protocol.icd.observability.DecodeFailureEvent;
import com.questrail.radarlink.protocol.icd.observability.RecordingObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.TransportObservabilityEvent;
import com.questrail.radarlink.protocol.icd.time.DeterministicScheduler;
import com.questrail.radarlink.protocol.icd.time.ManualMonotonicClock;
import com.questrail.radarlink.protocol.icd.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamTransportAdapterIntegrationTest
 * -----------------------------------------------------------------------------
 * A whole link against a scripted radar, with every production component
 * except the socket:
 *
 * <pre>
 *   FakeStreamEndpoint → StreamTransportAdapter → RadarLinkController
 *                                ↑                        │
 *              TcpSessionIntentExecutor ← TimedSessionIntentExecutor
 * </pre>
 *
 * Time is manual and the controller is drained explicitly, so every step is
 * deterministic.
 */
class StreamTransportAdapterIntegrationTest {

    private static final long RADAR_SOURCE = 0x2000;

    private FakeStreamEndpoint endpoint;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private RadarLinkController controller;
    private StreamTransportAdapter adapter;
    private TimedSessionIntentExecutor timed;
    private DefaultRadarMessageDecoder decoder;
    private OutboundMessageFactory radar;
    private List<DecodedMessage> delivered;

    @BeforeEach
    void setUp() {
        ProtocolRevision revision = ProtocolRevision.icd();
        SessionPolicy policy = SessionPolicy.defaults();
        WallClock wallClock = () -> Instant.parse("2026-05-01T08:00:00Z");

        MessageHeaderCodec headerCodec = new MessageHeaderCodec(HeaderFieldOrder.SOURCE_FIRST);
        MessageRegistry registry = MessageRegistry.standard(MessageCatalog.defaults(), revision.controlLayout());
        DefaultRadarMessageEncoder encoder = new DefaultRadarMessageEncoder(headerCodec, registry);
        decoder = new DefaultRadarMessageDecoder(headerCodec, registry);
        radar = new OutboundMessageFactory(encoder, RADAR_SOURCE, wallClock, ZoneOffset.UTC);

        endpoint = new FakeStreamEndpoint();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        delivered = new ArrayList<>();

        // The controller does not exist yet when the adapter needs its sink.
        RadarLinkController[] ref = new RadarLinkController[1];
        adapter = new StreamTransportAdapter(endpoint, headerCodec, 4096, decoder,
                new OutboundMessageFactory(encoder, 0x1000, wallClock, ZoneOffset.UTC),
                event -> ref[0].submit(event), delivered::add, sink, wallClock);

        TcpSessionIntentExecutor tcp = new TcpSessionIntentExecutor(adapter, revision, ControlParameters.defaults());
        timed = new TimedSessionIntentExecutor(tcp, event -> ref[0].submit(event),
                clock, scheduler, wallClock, policy.heartbeatInterval());

        controller = new RadarLinkController(LinkSessionState.disconnected(wallClock.now()),
                new SessionReducer(policy, revision), timed, sink, wallClock);
        ref[0] = controller;
    }

    private void radarSends(RadarMessage... messages) {
        for (RadarMessage m : messages) {
            endpoint.injectBytes(radar.build(m));
        }
        controller.drain();
    }

    private List<RadarMessage> sentSinceLastCheck() {
        List<RadarMessage> bodies = endpoint.sent().stream()
                .map(bytes -> ((DecodeResult.Decoded) decoder.decode(bytes)).message().body())
                .collect(Collectors.toList());
        endpoint.clear();
        return bodies;
    }

    private static SystemStatus status(RadarStatusState state) {
        return SystemStatus.basic(state.code(), 0, 0);
    }

    @Test
    void radarIsBroughtFromConnectToOperate() {
        adapter.start();
        controller.drain();

        assertEquals(LinkPhase.CONNECTED, controller.state().phase());
        assertEquals(List.of(KeepAlive.empty()), sentSinceLastCheck());
        assertTrue(timed.heartbeatArmed());

        radarSends(status(RadarStatusState.IDLE), status(RadarStatusState.IDLE));
        assertEquals(LinkPhase.STANDBY_REQUESTED, controller.state().phase());
        List<RadarMessage> out = sentSinceLastCheck();
        assertEquals(1, out.size());
        assertEquals(2, ((SystemControl) out.get(0)).radarState());

        radarSends(status(RadarStatusState.STANDBY));
        assertEquals(LinkPhase.STANDBY, controller.state().phase());
        assertEquals(List.of(new Acknowledge(3)), sentSinceLastCheck());

        radarSends(status(RadarStatusState.STANDBY), status(RadarStatusState.STANDBY), status(RadarStatusState.STANDBY));
        assertEquals(LinkPhase.OPERATE_REQUESTED, controller.state().phase());
        out = sentSinceLastCheck();
        assertEquals(new Acknowledge(6), out.get(0));
        assertEquals(4, ((SystemControl) out.get(1)).radarState());

        radarSends(status(RadarStatusState.OPERATIONAL));
        assertEquals(LinkPhase.OPERATE, controller.state().phase());
        assertTrue(sentSinceLastCheck().isEmpty());
    }

    @Test
    void heartbeatSendsKeepAliveEverySecond() {
        adapter.start();
        controller.drain();
        sentSinceLastCheck();

        clock.advance(Duration.ofSeconds(3));
        scheduler.runDueTasks();
        controller.drain();

        assertEquals(List.of(KeepAlive.empty(), KeepAlive.empty(), KeepAlive.empty()), sentSinceLastCheck());
    }

    @Test
    void messagesSplitAndCoalescedAcrossChunksAreDelivered() {
        adapter.start();
        controller.drain();

        byte[] a = radar.build(TargetReport.of(List.of(new Target(5, 12_000, 90_000, 1_000, 250, 50, 1, 99))));
        byte[] b = radar.build(status(RadarStatusState.IDLE));
        byte[] stream = new byte[a.length + b.length];
        System.arraycopy(a, 0, stream, 0, a.length);
        System.arraycopy(b, 0, stream, a.length, b.length);

        endpoint.injectBytes(Arrays.copyOfRange(stream, 0, 11));
        endpoint.injectBytes(Arrays.copyOfRange(stream, 11, a.length + 5));
        endpoint.injectBytes(Arrays.copyOfRange(stream, a.length + 5, stream.length));
        controller.drain();

        assertEquals(2, delivered.size());
        assertInstanceOf(TargetReport.class, delivered.get(0).body());
        assertEquals(RADAR_SOURCE, delivered.get(0).header().sourceId());
        assertEquals(1, controller.state().dataMessageCount());
        assertEquals(1, controller.state().statusCount());
    }

    @Test
    void garbageIsSkippedAndReported() {
        adapter.start();
        controller.drain();

        endpoint.injectBytes(new byte[] {(byte) 0xFF, (byte) 0xFF});
        radarSends(status(RadarStatusState.IDLE));

        assertEquals(2, adapter.framingDesyncCount());
        List<DecodeFailureEvent> failures = sink.eventsOfType(DecodeFailureEvent.class);
        assertEquals(2, failures.size());
        assertEquals(DecodeErrorKind.FRAMING_DESYNC, failures.get(0).error().kind());
        assertEquals(1, controller.state().statusCount());
    }

    @Test
    void shortStatusStillCountsTowardsActivation() {
        adapter.start();
        controller.drain();
        sentSinceLastCheck();

        byte[] shortStatus = radar.build(new GenericMessage(MessageKind.SYSTEM_STATUS.defaultId(), new byte[8]));
        endpoint.injectBytes(shortStatus);
        endpoint.injectBytes(radar.build(new GenericMessage(MessageKind.SYSTEM_STATUS.defaultId(), new byte[8])));
        controller.drain();

        assertEquals(2, controller.state().statusCount());
        assertEquals(LinkPhase.STANDBY_REQUESTED, controller.state().phase());
        assertTrue(delivered.isEmpty());
        assertEquals(2, sink.eventsOfType(DecodeFailureEvent.class).size());
        assertInstanceOf(SystemControl.class, sentSinceLastCheck().get(0));
    }

    @Test
    void disconnectResetsSessionAndStopsHeartbeat() {
        adapter.start();
        controller.drain();
        radarSends(status(RadarStatusState.IDLE), status(RadarStatusState.IDLE));

        endpoint.disconnect(new IOException("connection reset"));
        controller.drain();

        assertEquals(LinkPhase.DISCONNECTED, controller.state().phase());
        assertEquals(0, controller.state().statusCount());
        assertFalse(timed.heartbeatArmed());

        List<TransportObservabilityEvent> transport = sink.eventsOfType(TransportObservabilityEvent.class);
        assertEquals(TransportObservabilityEvent.Kind.DOWN, transport.get(transport.size() - 1).kind());

        endpoint.clear();
        clock.advance(Duration.ofSeconds(2));
        scheduler.runDueTasks();
        controller.drain();
        assertTrue(endpoint.sent().isEmpty());
    }
}
