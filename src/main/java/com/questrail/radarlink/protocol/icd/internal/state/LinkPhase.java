package com.questrail.radarlink.protocol.icd.internal.state;

/**
 * Lifecycle phase of the C2 side of a radar link.
 *
 * <pre>
 *   DISCONNECTED → CONNECTED → STANDBY_REQUESTED → STANDBY
 *                → OPERATE_REQUESTED → OPERATE
 *   any          → DISCONNECTED  (channel loss)
 * </pre>
 */
public enum LinkPhase
{
    /** No channel. Only a channel-up event has any effect. */
    DISCONNECTED,

    /** Channel open, heartbeats flowing, waiting for status reports. */
    CONNECTED,

    /** Standby control sent; waiting for the radar to report standby. */
    STANDBY_REQUESTED,

    /** Radar confirmed standby. */
    STANDBY,

    /** Operate control sent; waiting for the radar to report operational. */
    OPERATE_REQUESTED,

    /** Radar reports operational. */
    OPERATE;

    public boolean isConnected() {
        return this != DISCONNECTED;
    }
}
