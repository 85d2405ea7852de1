package com.questrail.radarlink.protocol.icd.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Keep-alive heartbeat.
 *
 * <p>
 * The ICD defines an empty payload, so a conforming keep-alive is exactly the
 * 20-byte header. Peers have been seen padding it; any trailing bytes are
 * accepted and kept in {@link #extra()} rather than rejected.
 * </p>
 */
public record KeepAlive(byte[] extra) implements RadarMessage
{
    private static final KeepAlive EMPTY = new KeepAlive(new byte[0]);

    public KeepAlive {
        Objects.requireNonNull(extra, "extra");
        extra = extra.clone();
    }

    /** The conforming, payload-free keep-alive. */
    public static KeepAlive empty() {
        return EMPTY;
    }

    @Override
    public byte[] extra() {
        return extra.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeepAlive other && Arrays.equals(extra, other.extra);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(extra);
    }

    @Override
    public String toString() {
        return "KeepAlive[extra=" + extra.length + " bytes]";
    }
}
