package com.questrail.radarlink.protocol.icd.runtime;

import com.questrail.radarlink.protocol.icd.codec.RadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.RadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.impl.DefaultRadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageHeaderCodec;
import com.questrail.radarlink.protocol.icd.codec.impl.OutboundMessageFactory;
import com.questrail.radarlink.protocol.icd.config.RadarLinkConfig;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.exec.SessionDriver;
import com.questrail.radarlink.protocol.icd.internal.exec.TimedSessionIntentExecutor;
import com.questrail.radarlink.protocol.icd.internal.state.LinkSessionState;
import com.questrail.radarlink.protocol.icd.internal.state.SessionReducer;
import com.questrail.radarlink.protocol.icd.internal.time.MonotonicClock;
import com.questrail.radarlink.protocol.icd.internal.time.MonotonicScheduler;
import com.questrail.radarlink.protocol.icd.internal.time.ScheduledExecutorScheduler;
import com.questrail.radarlink.protocol.icd.internal.time.SystemMonotonicClock;
import com.questrail.radarlink.protocol.icd.internal.time.SystemWallClock;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.model.DecodedMessage;
import com.questrail.radarlink.protocol.icd.observability.DecodeFailureEvent;
import com.questrail.radarlink.protocol.icd.observability.HeaderWarningEvent;
import com.questrail.radarlink.protocol.icd.observability.SessionErrorEvent;
import com.questrail.radarlink.protocol.icd.observability.SessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionTransitionEvent;
import com.questrail.radarlink.protocol.icd.observability.Slf4jSessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.TransportObservabilityEvent;
import com.questrail.radarlink.protocol.icd.transport.StreamEndpoint;
import com.questrail.radarlink.protocol.icd.transport.tcp.StreamTransportAdapter;
import com.questrail.radarlink.protocol.icd.transport.tcp.TcpSessionIntentExecutor;
import com.questrail.radarlink.protocol.icd.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * RadarLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one C2 link to a radar controller.
 *
 * <pre>
 *   NettyTcpStreamEndpoint ⇄ StreamTransportAdapter ⇄ SessionDriver
 *                                  ↑                        │
 *                     TcpSessionIntentExecutor ← TimedSessionIntentExecutor
 * </pre>
 *
 * <p>No reconnect: once the channel is lost the session stays
 * {@code DISCONNECTED} until the runtime is rebuilt.</p>
 */
public final class RadarLinkRuntime {
    private final SessionDriver driver;
    private final StreamTransportAdapter transport;
    private final TimedSessionIntentExecutor timedExecutor;
    private final ScheduledExecutorService schedulerExecutor;

    private RadarLinkRuntime(
            SessionDriver driver,
            StreamTransportAdapter transport,
            TimedSessionIntentExecutor timedExecutor,
            ScheduledExecutorService schedulerExecutor) {
        this.driver = driver;
        this.transport = transport;
        this.timedExecutor = timedExecutor;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        driver.start();
        transport.start();
    }

    public void stop() {
        transport.stop();
        timedExecutor.cancelHeartbeat();
        driver.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public LinkSessionState currentState() {
        return driver.currentState();
    }

    public void submitEvent(SessionEvent event) {
        driver.submitEvent(event);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RadarLinkConfig config;
        private StreamEndpoint endpoint;
        private SessionObservabilitySink observabilitySink = new Slf4jSessionObservabilitySink();
        private Consumer<DecodedMessage> messageListener;
        private Consumer<LinkSessionState> statusCallback;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ZoneId zone = ZoneId.systemDefault();

        public Builder withConfig(RadarLinkConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Overrides the transport; by default a Netty TCP client to the
         * configured remote address is used.
         */
        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Replaces the default SLF4J sink.
         */
        public Builder withObservabilitySink(SessionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Receives every decoded inbound message (targets, status, motion, ...).
         */
        public Builder withMessageListener(Consumer<DecodedMessage> listener) {
            this.messageListener = listener;
            return this;
        }

        /**
         * Receives the session state after every processed event.
         */
        public Builder withStatusCallback(Consumer<LinkSessionState> callback) {
            this.statusCallback = callback;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Zone whose midnight anchors outbound header time tags.
         */
        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public RadarLinkRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(zone, "zone");

            // 1. Core dependencies
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "radarlink-heartbeat");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            SessionReducer reducer = new SessionReducer(config.sessionPolicy(), config.revision());

            // 2. Codec
            MessageHeaderCodec headerCodec = new MessageHeaderCodec(config.revision().headerOrder());
            MessageRegistry registry = MessageRegistry.standard(config.catalog(), config.revision().controlLayout());
            RadarMessageDecoder decoder = new DefaultRadarMessageDecoder(headerCodec, registry);
            RadarMessageEncoder encoder = new DefaultRadarMessageEncoder(headerCodec, registry);
            OutboundMessageFactory outbound = new OutboundMessageFactory(encoder, config.sourceId(), wallClock, zone);

            // 3. Driver reference breaks the driver → executor → adapter → driver cycle.
            AtomicReference<SessionDriver> driverRef = new AtomicReference<>();
            Consumer<SessionEvent> eventSink = event -> driverRef.get().submitEvent(event);

            SessionObservabilitySink effectiveSink = observabilitySink;
            if (statusCallback != null) {
                effectiveSink = new StatusCallbackSink(observabilitySink, statusCallback);
            }

            // 4. Transport
            StreamEndpoint effectiveEndpoint = endpoint != null
                    ? endpoint
                    : new NettyTcpStreamEndpoint(config.remoteAddress());
            StreamTransportAdapter adapter = new StreamTransportAdapter(
                    effectiveEndpoint,
                    headerCodec,
                    config.maxMessageLength(),
                    decoder,
                    outbound,
                    eventSink,
                    messageListener,
                    effectiveSink,
                    wallClock);

            // 5. Executors
            TcpSessionIntentExecutor tcpExecutor = new TcpSessionIntentExecutor(
                    adapter, config.revision(), config.controlParameters());
            TimedSessionIntentExecutor timedExecutor = new TimedSessionIntentExecutor(
                    tcpExecutor,
                    eventSink,
                    clock,
                    scheduler,
                    wallClock,
                    config.sessionPolicy().heartbeatInterval());

            // 6. Driver
            LinkSessionState initialState = LinkSessionState.disconnected(wallClock.now());
            SessionDriver driver = new SessionDriver(
                    reducer,
                    timedExecutor,
                    () -> initialState,
                    effectiveSink,
                    wallClock);
            driverRef.set(driver);

            return new RadarLinkRuntime(driver, adapter, timedExecutor, schedulerExec);
        }
    }

    /**
     * Forwards everything to the configured sink and reports each new state
     * to a status callback.
     */
    private static final class StatusCallbackSink implements SessionObservabilitySink {
        private final SessionObservabilitySink delegate;
        private final Consumer<LinkSessionState> statusCallback;

        private StatusCallbackSink(SessionObservabilitySink delegate, Consumer<LinkSessionState> statusCallback) {
            this.delegate = delegate;
            this.statusCallback = statusCallback;
        }

        @Override
        public void onStateTransition(SessionTransitionEvent event) {
            delegate.onStateTransition(event);
            statusCallback.accept(event.newState());
        }

        @Override public void onDecodeFailure(DecodeFailureEvent event) { delegate.onDecodeFailure(event); }
        @Override public void onHeaderWarning(HeaderWarningEvent event) { delegate.onHeaderWarning(event); }
        @Override public void onTransportEvent(TransportObservabilityEvent event) { delegate.onTransportEvent(event); }
        @Override public void onError(SessionErrorEvent event) { delegate.onError(event); }
    }
}
