package com.questrail.hostbridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bridge.
 */
public record HostBridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
