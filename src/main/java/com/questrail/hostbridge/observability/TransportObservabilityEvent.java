package com.questrail.hostbridge.observability;

import com.questrail.hostbridge.api.Transport;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record of a transport lifecycle change.
 *
 * @param address local address for UP/DOWN, remote address for connection events
 * @param cause   diagnostic cause; {@code null} for orderly transitions
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Transport transport,
    Kind kind,
    SocketAddress address,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN,
        CONNECTION_OPENED,
        CONNECTION_CLOSED
    }
}
