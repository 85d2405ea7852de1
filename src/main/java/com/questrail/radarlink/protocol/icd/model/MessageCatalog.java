package com.questrail.radarlink.protocol.icd.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MessageCatalog
 * -----------------------------------------------------------------------------
 * Immutable, bidirectional binding between wire message identifiers and
 * {@link MessageKind}s.
 *
 * <p>The catalog is configuration data. Radar builds have been observed to
 * disagree on individual identifiers, so the binding can be adjusted with
 * {@link Builder#assign(MessageKind, long)} without touching any decoder.</p>
 *
 * <p>Identifiers must be unique: two kinds may not share an id.</p>
 */
public final class MessageCatalog
{
    private final Map<MessageKind, Long> idsByKind;
    private final Map<Long, MessageKind> kindsById;

    private MessageCatalog(Map<MessageKind, Long> idsByKind) {
        Map<Long, MessageKind> reverse = new HashMap<>();
        for (Map.Entry<MessageKind, Long> e : idsByKind.entrySet()) {
            MessageKind previous = reverse.put(e.getValue(), e.getKey());
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                        "Message id 0x%08X assigned to both %s and %s", e.getValue(), previous, e.getKey()));
            }
        }
        this.idsByKind = Collections.unmodifiableMap(new EnumMap<>(idsByKind));
        this.kindsById = Map.copyOf(reverse);
    }

    /**
     * The catalog with every kind bound to its {@link MessageKind#defaultId()}.
     */
    public static MessageCatalog defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a wire identifier to its kind, if the catalog knows it.
     */
    public Optional<MessageKind> kindOf(long messageId) {
        return Optional.ofNullable(kindsById.get(messageId));
    }

    /**
     * Returns the wire identifier bound to {@code kind}.
     *
     * @throws IllegalArgumentException if the kind has been unassigned
     */
    public long idOf(MessageKind kind) {
        Objects.requireNonNull(kind, "kind");
        Long id = idsByKind.get(kind);
        if (id == null) {
            throw new IllegalArgumentException("No message id assigned to " + kind);
        }
        return id;
    }

    /**
     * Human-readable name for an identifier; unknown ids render as
     * {@code Unknown (0xXXXXXXXX)}.
     */
    public String displayName(long messageId) {
        return kindOf(messageId)
                .map(MessageKind::displayName)
                .orElseGet(() -> String.format("Unknown (0x%08X)", messageId));
    }

    public static final class Builder {
        private final EnumMap<MessageKind, Long> ids = new EnumMap<>(MessageKind.class);

        private Builder() {
            for (MessageKind kind : MessageKind.values()) {
                ids.put(kind, kind.defaultId());
            }
        }

        /**
         * Rebinds {@code kind} to {@code messageId}.
         */
        public Builder assign(MessageKind kind, long messageId) {
            Objects.requireNonNull(kind, "kind");
            MessageHeader.requireU32(messageId, "messageId");
            ids.put(kind, messageId);
            return this;
        }

        /**
         * Removes {@code kind} from the catalog; its id then decodes as generic.
         */
        public Builder unassign(MessageKind kind) {
            Objects.requireNonNull(kind, "kind");
            ids.remove(kind);
            return this;
        }

        public MessageCatalog build() {
            return new MessageCatalog(ids);
        }
    }
}
