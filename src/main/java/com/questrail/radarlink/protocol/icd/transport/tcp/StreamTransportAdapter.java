package com.questrail.radarlink.protocol.icd.transport.tcp;

import com.questrail.radarlink.protocol.icd.codec.RadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageFramer;
import com.questrail.radarlink.protocol.icd.codec.impl.MessageHeaderCodec;
import com.questrail.radarlink.protocol.icd.codec.impl.OutboundMessageFactory;
import com.questrail.radarlink.protocol.icd.internal.events.ChannelEvent;
import com.questrail.radarlink.protocol.icd.internal.events.MessageEvent;
import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.model.DecodeResult;
import com.questrail.radarlink.protocol.icd.model.DecodedMessage;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;
import com.questrail.radarlink.protocol.icd.observability.NullSessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.SessionObservabilitySink;
import com.questrail.radarlink.protocol.icd.observability.TransportObservabilityEvent;
import com.questrail.radarlink.protocol.icd.transport.StreamEndpoint;
import com.questrail.radarlink.protocol.icd.transport.StreamEndpointListener;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * StreamTransportAdapter
 * =============================================================================
 * Translation layer between a {@link StreamEndpoint} and the link session.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   StreamEndpoint.onBytes
 *        → MessageFramer          (complete messages; desync → DecodeFailed)
 *            → RadarMessageDecoder
 *                → MessageEvent.MessageReceived | MessageEvent.DecodeFailed
 *                    → session event sink
 *                → message listener (decoded messages only)
 * </pre>
 *
 * <h2>Outbound path (executor-authoritative)</h2>
 * <pre>
 *   RadarMessage
 *        → OutboundMessageFactory (stamp + encode)
 *            → StreamEndpoint.send(byte[])
 * </pre>
 *
 * <h2>Non-responsibilities</h2>
 * No retries, timing or reconnects. Channel loss resets the framer so a
 * partial message never leaks into the next connection.
 *
 * <p>Listener callbacks are serialized on this adapter's monitor because
 * {@link StreamEndpoint#stop()} may report down from a thread other than the
 * one delivering bytes.</p>
 */
public class StreamTransportAdapter implements StreamEndpointListener {

    private final StreamEndpoint endpoint;
    private final MessageFramer framer;
    private final RadarMessageDecoder decoder;
    private final OutboundMessageFactory outbound;
    private final Consumer<SessionEvent> eventSink;
    private final Consumer<DecodedMessage> messageListener;
    private final SessionObservabilitySink observabilitySink;
    private final WallClock wallClock;

    /**
     * @param messageListener receives every decoded message; may be {@code null}
     * @param observabilitySink may be {@code null}
     */
    public StreamTransportAdapter(StreamEndpoint endpoint,
                                  MessageHeaderCodec headerCodec,
                                  int maxMessageLength,
                                  RadarMessageDecoder decoder,
                                  OutboundMessageFactory outbound,
                                  Consumer<SessionEvent> eventSink,
                                  Consumer<DecodedMessage> messageListener,
                                  SessionObservabilitySink observabilitySink,
                                  WallClock wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.messageListener = messageListener != null ? messageListener : m -> { };
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullSessionObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.framer = new MessageFramer(Objects.requireNonNull(headerCodec, "headerCodec"),
                maxMessageLength, this::onFramingDesync);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    /**
     * Stamp, encode and write one message.
     */
    public void send(RadarMessage message) {
        Objects.requireNonNull(message, "message");
        endpoint.send(outbound.build(message));
    }

    /**
     * Number of implausible length fields skipped since this adapter was created.
     */
    public long framingDesyncCount() {
        return framer.desyncCount();
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public synchronized void onTransportUp() {
        framer.reset();
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), TransportObservabilityEvent.Kind.UP, "channel connected", null));
        eventSink.accept(new ChannelEvent.ChannelUp(wallClock.now()));
    }

    @Override
    public synchronized void onTransportDown(Throwable cause) {
        framer.reset();
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), TransportObservabilityEvent.Kind.DOWN,
                cause == null ? "channel closed" : "channel failed", cause));
        eventSink.accept(new ChannelEvent.ChannelDown(wallClock.now()));
    }

    @Override
    public synchronized void onBytes(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");

        for (byte[] message : framer.feed(chunk)) {
            DecodeResult result = decoder.decode(message);
            if (result instanceof DecodeResult.Decoded decoded) {
                eventSink.accept(new MessageEvent.MessageReceived(wallClock.now(), decoded.message()));
                messageListener.accept(decoded.message());
            } else if (result instanceof DecodeResult.Failed failed) {
                eventSink.accept(new MessageEvent.DecodeFailed(wallClock.now(), failed.error()));
            }
        }
    }

    private void onFramingDesync(DecodeError error) {
        eventSink.accept(new MessageEvent.DecodeFailed(wallClock.now(), error));
    }
}
