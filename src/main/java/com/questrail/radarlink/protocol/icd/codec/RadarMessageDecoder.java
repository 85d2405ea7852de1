package com.questrail.radarlink.protocol.icd.codec;

import com.questrail.radarlink.protocol.icd.model.DecodeResult;

/**
 * RadarMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one complete wire message and its semantic form.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Reading the header in the configured field order</li>
 *   <li>Flagging declared-length mismatches as warnings</li>
 *   <li>Dispatching the payload to the codec registered for its identifier</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Splitting a byte stream into messages (see the stream framer)</li>
 *   <li>Reacting to message content</li>
 * </ul>
 *
 * <p>Decoding never throws for bad input. Short messages and short payloads
 * come back as {@link DecodeResult.Failed}; unknown identifiers come back as
 * generic messages.</p>
 */
public interface RadarMessageDecoder
{
    /**
     * Decode exactly one message (header plus payload).
     *
     * @param message the bytes of one message, as delimited by the framer
     * @return the decoded message or a decode error value
     */
    DecodeResult decode(byte[] message);
}
