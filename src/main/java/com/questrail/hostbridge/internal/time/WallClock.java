package com.questrail.hostbridge.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to stamp inbound commands and observability events.
 *
 * <p>May jump due to NTP or manual adjustment; never use it for timeouts.</p>
 */
public interface WallClock
{
    Instant now();
}
