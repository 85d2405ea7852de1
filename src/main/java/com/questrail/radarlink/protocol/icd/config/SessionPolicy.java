package com.questrail.radarlink.protocol.icd.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SessionPolicy
 * -----------------------------------------------------------------------------
 * Thresholds and cadence that drive the link session state machine.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>standbyThreshold</b>: number of status reports received while
 *       connected before the C2 requests standby.</li>
 *   <li><b>operateThreshold</b>: number of status reports received before the
 *       C2 requests operate. Must exceed {@code standbyThreshold}.</li>
 *   <li><b>acknowledgeEvery</b>: every N-th status report is acknowledged with
 *       that report's sequence number.</li>
 *   <li><b>heartbeatInterval</b>: keep-alive cadence while connected.</li>
 * </ul>
 *
 * <p>The thresholds count <em>all</em> status reports since the channel came
 * up, including ones whose payload was too short to decode.</p>
 */
public record SessionPolicy(
        int standbyThreshold,
        int operateThreshold,
        int acknowledgeEvery,
        Duration heartbeatInterval
) {
    public SessionPolicy {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");

        if (standbyThreshold < 1) {
            throw new IllegalArgumentException("standbyThreshold must be >= 1");
        }
        if (operateThreshold <= standbyThreshold) {
            throw new IllegalArgumentException("operateThreshold must exceed standbyThreshold");
        }
        if (acknowledgeEvery < 1) {
            throw new IllegalArgumentException("acknowledgeEvery must be >= 1");
        }
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
    }

    /**
     * Defaults observed on deployed links.
     *
     * <ul>
     *   <li>standbyThreshold: 2</li>
     *   <li>operateThreshold: 6</li>
     *   <li>acknowledgeEvery: 3</li>
     *   <li>heartbeatInterval: 1s</li>
     * </ul>
     */
    public static SessionPolicy defaults() {
        return new SessionPolicy(2, 6, 3, Duration.ofSeconds(1));
    }
}
