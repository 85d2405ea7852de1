package com.questrail.radarlink.protocol.icd.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time source.
 *
 * <p>Used for two things only: the millisecond-of-day time tag stamped into
 * outbound headers, and event and observability timestamps. It may jump, so it
 * never drives timing decisions.</p>
 */
public interface WallClock
{
    Instant now();
}
