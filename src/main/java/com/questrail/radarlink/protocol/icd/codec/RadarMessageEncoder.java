package com.questrail.radarlink.protocol.icd.codec;

import com.questrail.radarlink.protocol.icd.model.MessageStamp;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

/**
 * RadarMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary from a semantic message to wire bytes.
 *
 * <p>The encoder owns the message identifier (looked up in the catalog) and
 * the length field (computed from the payload). Everything else in the header
 * comes from the caller's {@link MessageStamp}.</p>
 */
public interface RadarMessageEncoder
{
    /**
     * Encode {@code message} into header plus payload.
     *
     * @param stamp   sender, time tag and sequence number for the header
     * @param message body to encode
     * @return the complete message bytes
     */
    byte[] encode(MessageStamp stamp, RadarMessage message);
}
