package com.questrail.radarlink.protocol.icd.config;

import com.questrail.radarlink.protocol.icd.codec.impl.MessageFramer;
import com.questrail.radarlink.protocol.icd.model.MessageCatalog;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for one C2 link to a radar controller.
 */
public record RadarLinkConfig(
    InetSocketAddress remoteAddress,
    long sourceId,
    ProtocolRevision revision,
    SessionPolicy sessionPolicy,
    ControlParameters controlParameters,
    MessageCatalog catalog,
    int maxMessageLength
) {
    public static final long DEFAULT_SOURCE_ID = 0x1000;

    public RadarLinkConfig {
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(revision, "revision");
        Objects.requireNonNull(sessionPolicy, "sessionPolicy");
        Objects.requireNonNull(controlParameters, "controlParameters");
        Objects.requireNonNull(catalog, "catalog");
        if (sourceId < 0 || sourceId > MessageHeader.U32_MAX) {
            throw new IllegalArgumentException("sourceId out of u32 range: " + sourceId);
        }
        if (maxMessageLength < MessageHeader.SIZE) {
            throw new IllegalArgumentException("maxMessageLength must be >= " + MessageHeader.SIZE);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress remoteAddress;
        private long sourceId = DEFAULT_SOURCE_ID;
        private ProtocolRevision revision = ProtocolRevision.icd();
        private SessionPolicy sessionPolicy = SessionPolicy.defaults();
        private ControlParameters controlParameters = ControlParameters.defaults();
        private MessageCatalog catalog = MessageCatalog.defaults();
        private int maxMessageLength = MessageFramer.DEFAULT_MAX_MESSAGE_LENGTH;

        public Builder withRemoteAddress(InetSocketAddress remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder withSourceId(long sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder withRevision(ProtocolRevision revision) {
            this.revision = revision;
            return this;
        }

        public Builder withSessionPolicy(SessionPolicy sessionPolicy) {
            this.sessionPolicy = sessionPolicy;
            return this;
        }

        public Builder withControlParameters(ControlParameters controlParameters) {
            this.controlParameters = controlParameters;
            return this;
        }

        public Builder withCatalog(MessageCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder withMaxMessageLength(int maxMessageLength) {
            this.maxMessageLength = maxMessageLength;
            return this;
        }

        public RadarLinkConfig build() {
            return new RadarLinkConfig(remoteAddress, sourceId, revision, sessionPolicy,
                    controlParameters, catalog, maxMessageLength);
        }
    }
}
