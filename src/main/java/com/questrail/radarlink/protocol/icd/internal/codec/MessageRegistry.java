package com.questrail.radarlink.protocol.icd.internal.codec;

import com.questrail.radarlink.protocol.icd.config.SystemControlLayout;
import com.questrail.radarlink.protocol.icd.model.MessageCatalog;
import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MessageRegistry
 * -----------------------------------------------------------------------------
 * Dispatch table from message identifier to payload codec.
 *
 * <p>Resolution is two-step: the {@link MessageCatalog} maps a wire id to a
 * {@link MessageKind}, and this registry maps the kind to its
 * {@link PayloadCodec}. A catalogued kind with no registered codec (BIT data,
 * maintenance requests, ...) and an uncatalogued id both resolve to nothing,
 * which the message decoder turns into a generic message.</p>
 *
 * <p>Instances are immutable and safe to share.</p>
 */
public final class MessageRegistry
{
    private final MessageCatalog catalog;
    private final Map<MessageKind, PayloadCodec<?>> codecsByKind;
    private final Map<Class<?>, PayloadCodec<?>> codecsByType;

    private MessageRegistry(MessageCatalog catalog, Map<MessageKind, PayloadCodec<?>> codecs) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.codecsByKind = new EnumMap<>(MessageKind.class);
        this.codecsByKind.putAll(codecs);

        Map<Class<?>, PayloadCodec<?>> byType = new HashMap<>();
        for (PayloadCodec<?> codec : codecs.values()) {
            byType.put(codec.messageType(), codec);
        }
        this.codecsByType = Map.copyOf(byType);
    }

    /**
     * Registry holding every structured payload codec, with system control
     * laid out per {@code controlLayout}.
     */
    public static MessageRegistry standard(MessageCatalog catalog, SystemControlLayout controlLayout) {
        return builder(catalog)
                .register(new KeepAliveCodec())
                .register(new SystemControlCodec(controlLayout))
                .register(new SystemStatusCodec())
                .register(new AcknowledgeCodec())
                .register(new TargetReportCodec())
                .register(new SingleTargetReportCodec())
                .register(new ExtendedTargetCodec())
                .register(new SystemMotionCodec())
                .register(new SensorPositionCodec())
                .build();
    }

    public static Builder builder(MessageCatalog catalog) {
        return new Builder(catalog);
    }

    public MessageCatalog catalog() {
        return catalog;
    }

    /**
     * Catalog kind for a wire identifier.
     */
    public Optional<MessageKind> kindOf(long messageId) {
        return catalog.kindOf(messageId);
    }

    /**
     * Payload codec registered for {@code kind}, if any.
     */
    public Optional<PayloadCodec<?>> codecFor(MessageKind kind) {
        return Optional.ofNullable(codecsByKind.get(kind));
    }

    /**
     * Payload codec that encodes {@code message}.
     *
     * @throws IllegalArgumentException if no codec handles the message's type
     */
    public PayloadCodec<?> codecForMessage(RadarMessage message) {
        PayloadCodec<?> codec = codecsByType.get(message.getClass());
        if (codec == null) {
            throw new IllegalArgumentException("No payload codec for " + message.getClass().getSimpleName());
        }
        return codec;
    }

    public static final class Builder {
        private final MessageCatalog catalog;
        private final Map<MessageKind, PayloadCodec<?>> codecs = new EnumMap<>(MessageKind.class);

        private Builder(MessageCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
        }

        /**
         * Registers a codec, replacing any codec previously registered for its kind.
         */
        public Builder register(PayloadCodec<?> codec) {
            Objects.requireNonNull(codec, "codec");
            codecs.put(codec.kind(), codec);
            return this;
        }

        public MessageRegistry build() {
            return new MessageRegistry(catalog, codecs);
        }
    }
}
