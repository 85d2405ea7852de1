package com.questrail.radarlink.protocol.icd.transport;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connected byte-stream transport (TCP-style) to one radar
 * controller.
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>reassembling messages from the byte stream and decoding them</li>
 *   <li>submitting the resulting session events</li>
 *   <li>triggering outbound sends from the intent executor</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Connect and begin receiving bytes.
     *
     * <p>On successful connection the endpoint notifies
     * {@link StreamEndpointListener#onTransportUp()} once. A failed connection
     * attempt is reported through {@link StreamEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources.
     *
     * <p>The listener sees at most one {@code onTransportDown} per connection,
     * whether the close was requested here or caused by the peer.</p>
     */
    void stop();

    /**
     * Write bytes to the peer. Bytes sent while the channel is not connected
     * are dropped; the endpoint never queues or retries.
     */
    void send(byte[] bytes);

    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(StreamEndpointListener listener);
}
