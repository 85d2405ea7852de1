package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

/**
 * PayloadCodec
 * -----------------------------------------------------------------------------
 * Decoder and encoder for the payload of one {@link MessageKind}.
 *
 * <p>Implementations are pure: they see only payload bytes (the header has
 * already been consumed) and must not retain state between calls.</p>
 *
 * @param <M> the message variant this codec produces
 */
public interface PayloadCodec<M extends RadarMessage>
{
    /**
     * Catalog kind this codec handles.
     */
    MessageKind kind();

    /**
     * Message variant this codec produces and accepts.
     */
    Class<M> messageType();

    /**
     * Decode a payload.
     *
     * @throws InsufficientPayloadException if the payload is shorter than the type requires
     */
    M decode(byte[] payload) throws InsufficientPayloadException;

    /**
     * Encode a message body to its payload bytes.
     */
    byte[] encode(M message);

    /**
     * Encode a body whose static type is only known to be {@link RadarMessage}.
     *
     * @throws ClassCastException if {@code message} is not a {@link #messageType()}
     */
    default byte[] encodeBody(RadarMessage message) {
        return encode(messageType().cast(message));
    }
}
