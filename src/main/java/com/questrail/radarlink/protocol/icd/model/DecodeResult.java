package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;

/**
 * Outcome of decoding one complete message: either a {@link DecodedMessage}
 * or a {@link DecodeError}.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Failed
{
    record Decoded(DecodedMessage message) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(message, "message");
        }
    }

    record Failed(DecodeError error) implements DecodeResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
