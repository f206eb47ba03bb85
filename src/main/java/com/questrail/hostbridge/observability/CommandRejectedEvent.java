package com.questrail.hostbridge.observability;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.model.ErrorKind;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record of an inbound message that never reached the host.
 *
 * @param commandName the requested name, or {@code null} if the message did not parse
 * @param remote      sender, or {@code null} if unknown
 */
public record CommandRejectedEvent(
    Instant timestamp,
    Transport transport,
    String commandName,
    ErrorKind kind,
    String reason,
    SocketAddress remote
) {
}
