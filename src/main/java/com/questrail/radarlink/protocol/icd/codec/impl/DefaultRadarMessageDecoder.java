package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.codec.RadarMessageDecoder;
import com.questrail.radarlink.protocol.icd.internal.codec.InsufficientPayloadException;
import com.questrail.radarlink.protocol.icd.internal.codec.MessageRegistry;
import com.questrail.radarlink.protocol.icd.internal.codec.PayloadCodec;
import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.model.DecodeResult;
import com.questrail.radarlink.protocol.icd.model.DecodedMessage;
import com.questrail.radarlink.protocol.icd.model.GenericMessage;
import com.questrail.radarlink.protocol.icd.model.HeaderWarning;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;
import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DefaultRadarMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RadarMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header decode; fewer than 20 bytes is {@code TOO_SHORT}</li>
 *   <li>Declared length versus bytes present, recorded as warnings</li>
 *   <li>Identifier lookup in the registry</li>
 *   <li>Payload decode by the registered codec, or a generic message when
 *       there is none</li>
 * </ol>
 *
 * <p>The payload handed to the codec is every byte after the header, whatever
 * the header declares.</p>
 */
public final class DefaultRadarMessageDecoder implements RadarMessageDecoder
{
    private final MessageHeaderCodec headerCodec;
    private final MessageRegistry registry;

    public DefaultRadarMessageDecoder(MessageHeaderCodec headerCodec, MessageRegistry registry) {
        this.headerCodec = Objects.requireNonNull(headerCodec, "headerCodec");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public DecodeResult decode(byte[] message)
    {
        Objects.requireNonNull(message, "message");

        Optional<MessageHeader> headerOpt = headerCodec.decode(message);
        if (headerOpt.isEmpty()) {
            return new DecodeResult.Failed(DecodeError.tooShort(message));
        }

        final MessageHeader header = headerOpt.get();
        final byte[] payload = Arrays.copyOfRange(message, MessageHeader.SIZE, message.length);
        final Set<HeaderWarning> warnings = lengthWarnings(header, message.length);

        Optional<MessageKind> kind = registry.kindOf(header.messageId());
        Optional<PayloadCodec<?>> codec = kind.flatMap(registry::codecFor);
        if (codec.isEmpty()) {
            return decoded(header, new GenericMessage(header.messageId(), payload), warnings);
        }

        try {
            return decoded(header, codec.get().decode(payload), warnings);
        }
        catch (InsufficientPayloadException e) {
            // Short payload → error value; the header and raw bytes are kept.
            return new DecodeResult.Failed(
                    DecodeError.insufficientPayload(header, kind.get(), payload, e.getMessage()));
        }
    }

    private static DecodeResult decoded(MessageHeader header, RadarMessage body, Set<HeaderWarning> warnings) {
        return new DecodeResult.Decoded(new DecodedMessage(header, body, warnings));
    }

    private static Set<HeaderWarning> lengthWarnings(MessageHeader header, int actualLength) {
        EnumSet<HeaderWarning> warnings = EnumSet.noneOf(HeaderWarning.class);
        if (header.messageLength() > actualLength) {
            warnings.add(HeaderWarning.DECLARED_LENGTH_EXCEEDS_DATA);
        }
        else if (header.messageLength() < actualLength) {
            warnings.add(HeaderWarning.DATA_EXCEEDS_DECLARED_LENGTH);
        }
        return warnings;
    }
}
