package com.questrail.radarlink.protocol.icd.internal.events;

import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.model.DecodedMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * MessageEvent
 * -----------------------------------------------------------------------------
 * Outcome of decoding one framed message.
 *
 * <p>Framing and header parsing happen below this layer; the reducer sees
 * either a semantic message or a decode error value, never raw bytes.</p>
 */
public sealed interface MessageEvent extends SessionEvent
        permits MessageEvent.MessageReceived, MessageEvent.DecodeFailed
{
    /**
     * A message was decoded, possibly with header warnings.
     */
    final class MessageReceived extends SessionEvent.Base implements MessageEvent
    {
        private final DecodedMessage message;

        public MessageReceived(Instant timestamp, DecodedMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        public DecodedMessage message() {
            return message;
        }
    }

    /**
     * A framed message could not be decoded. A short status report still
     * carries its header and counts toward the session thresholds.
     */
    final class DecodeFailed extends SessionEvent.Base implements MessageEvent
    {
        private final DecodeError error;

        public DecodeFailed(Instant timestamp, DecodeError error) {
            super(timestamp);
            this.error = Objects.requireNonNull(error, "error");
        }

        public DecodeError error() {
            return error;
        }
    }
}
