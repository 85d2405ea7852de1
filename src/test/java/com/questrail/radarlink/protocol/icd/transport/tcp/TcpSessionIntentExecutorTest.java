package com.questrail.radarlink.protocol.icd.transport.tcp;

import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.codec.impl.HeaderFieldOrder;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageHeaderCodec;
import com.questrail.radarlink.protocol.icd.codec.impl.OutboundMessageFactory;
import com.questrail.radarlink.protocol.icd.config.ControlParameters;
import com.questrail.radarlink.protocol.icd.config.ProtocolRevision;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;
import com.questrail.radarlink.protocol.icd.model.*;
import com.questrail.radarlink.protocol.icd.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TcpSessionIntentExecutorTest
 * -----------------------------------------------------------------------------
 * Intents become wire messages, in a fixed order, through a fake endpoint.
 */
class TcpSessionIntentExecutorTest {

    private FakeStreamEndpoint endpoint;
    private DefaultRadarMessageDecoder decoder;
    private TcpSessionIntentExecutor executor;

    @BeforeEach
    void setUp() {
        ProtocolRevision revision = ProtocolRevision.icd();
        MessageHeaderCodec headerCodec = new MessageHeaderCodec(HeaderFieldOrder.SOURCE_FIRST);
        MessageRegistry registry = MessageRegistry.standard(MessageCatalog.defaults(), revision.controlLayout());
        decoder = new DefaultRadarMessageDecoder(headerCodec, registry);
        OutboundMessageFactory outbound = new OutboundMessageFactory(
                new DefaultRadarMessageEncoder(headerCodec, registry), 0x1000, () -> Instant.EPOCH, ZoneOffset.UTC);

        endpoint = new FakeStreamEndpoint();
        StreamTransportAdapter adapter = new StreamTransportAdapter(endpoint, headerCodec, 65_536,
                decoder, outbound, event -> { }, null, null, () -> Instant.EPOCH);
        adapter.start();

        executor = new TcpSessionIntentExecutor(adapter, revision, new ControlParameters(1, 0x0101, 0x01, 7));
    }

    private List<RadarMessage> sentBodies() {
        return endpoint.sent().stream()
                .map(bytes -> ((DecodeResult.Decoded) decoder.decode(bytes)).message().body())
                .collect(Collectors.toList());
    }

    @Test
    void keepAliveIsHeaderOnly() {
        executor.execute(SessionIntents.sendKeepAlive());

        assertEquals(1, endpoint.sent().size());
        assertEquals(20, endpoint.sent().get(0).length);
        assertEquals(List.of(KeepAlive.empty()), sentBodies());
    }

    @Test
    void standbyRequestCarriesControlCodeAndConfiguredParameters() {
        executor.execute(SessionIntents.requestStandby());

        assertEquals(List.of(new SystemControl(2, 1, 0x0101, 0x01, 7)), sentBodies());
        assertEquals(60, endpoint.sent().get(0).length);
    }

    @Test
    void operateRequestUsesOperateCode() {
        executor.execute(SessionIntents.requestOperate());
        SystemControl control = (SystemControl) sentBodies().get(0);
        assertEquals(4, control.radarState());
    }

    @Test
    void acknowledgeIsSentBeforeControlRequest() {
        executor.execute(SessionIntents.builder()
                .add(SessionIntents.Kind.REQUEST_OPERATE)
                .acknowledge(42)
                .build());

        List<RadarMessage> bodies = sentBodies();
        assertEquals(2, bodies.size());
        assertEquals(new Acknowledge(42), bodies.get(0));
        assertInstanceOf(SystemControl.class, bodies.get(1));
    }

    @Test
    void sequenceNumbersIncreasePerMessage() {
        executor.execute(SessionIntents.sendKeepAlive().and(SessionIntents.sendAcknowledge(9)));
        executor.execute(SessionIntents.sendKeepAlive());

        List<Long> sequences = endpoint.sent().stream()
                .map(bytes -> ((DecodeResult.Decoded) decoder.decode(bytes)).message().header().sequenceNumber())
                .collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L), sequences);
    }

    @Test
    void heartbeatIntentsProduceNoTraffic() {
        executor.execute(SessionIntents.startHeartbeat().and(SessionIntents.stopHeartbeat()));
        executor.execute(SessionIntents.none());
        assertTrue(endpoint.sent().isEmpty());
    }
}
