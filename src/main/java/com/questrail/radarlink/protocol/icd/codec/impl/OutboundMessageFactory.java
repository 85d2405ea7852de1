package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.codec.RadarMessageEncoder;
import com.questrail.radarlink.protocol.icd.internal.time.WallClock;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;
import com.questrail.radarlink.protocol.icd.model.MessageStamp;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OutboundMessageFactory
 * -----------------------------------------------------------------------------
 * Stamps and encodes everything the C2 sends on one channel.
 *
 * <ul>
 *   <li><b>sourceId</b>: fixed per sender.</li>
 *   <li><b>timeTag</b>: milliseconds since local midnight, read from a
 *       {@link WallClock} in the configured zone.</li>
 *   <li><b>sequenceNumber</b>: starts at 1, increments per message, and
 *       wraps from {@code 0xFFFFFFFF} back to 1. Zero is never sent.</li>
 * </ul>
 *
 * <p>Thread-safe: sequence allocation is atomic.</p>
 */
public final class OutboundMessageFactory
{
    private final RadarMessageEncoder encoder;
    private final long sourceId;
    private final WallClock wallClock;
    private final ZoneId zone;
    private final AtomicLong sequence;

    public OutboundMessageFactory(RadarMessageEncoder encoder, long sourceId, WallClock wallClock, ZoneId zone) {
        this(encoder, sourceId, wallClock, zone, 0);
    }

    /**
     * @param lastSequence sequence number considered already used; the next
     *                     message carries the one after it
     */
    public OutboundMessageFactory(RadarMessageEncoder encoder,
                                  long sourceId,
                                  WallClock wallClock,
                                  ZoneId zone,
                                  long lastSequence)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
        if (sourceId < 0 || sourceId > MessageHeader.U32_MAX) {
            throw new IllegalArgumentException("sourceId out of u32 range: " + sourceId);
        }
        if (lastSequence < 0 || lastSequence > MessageHeader.U32_MAX) {
            throw new IllegalArgumentException("lastSequence out of u32 range: " + lastSequence);
        }
        this.sourceId = sourceId;
        this.sequence = new AtomicLong(lastSequence);
    }

    /**
     * Allocates the next stamp.
     */
    public MessageStamp nextStamp() {
        long seq = sequence.updateAndGet(s -> s >= MessageHeader.U32_MAX ? 1 : s + 1);
        return new MessageStamp(sourceId, timeTag(), seq);
    }

    /**
     * Stamps and encodes a message.
     */
    public byte[] build(RadarMessage message) {
        Objects.requireNonNull(message, "message");
        return encoder.encode(nextStamp(), message);
    }

    /**
     * Sequence number of the most recently built message, 0 if none yet.
     */
    public long lastSequenceNumber() {
        return sequence.get();
    }

    public long sourceId() {
        return sourceId;
    }

    private long timeTag() {
        LocalTime local = wallClock.now().atZone(zone).toLocalTime();
        return local.toNanoOfDay() / 1_000_000L;
    }
}
