package com.questrail.radarlink.protocol.icd.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty-backed endpoints deliver them on
 * the channel's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * The connection is established. Lifecycle signal only.
     */
    void onTransportUp();

    /**
     * The connection is gone.
     *
     * @param cause failure that closed the connection; {@code null} for an
     *              orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * Bytes arrived. Chunk boundaries carry no meaning: a chunk may hold part
     * of a message, exactly one, or several.
     */
    void onBytes(byte[] chunk);
}
