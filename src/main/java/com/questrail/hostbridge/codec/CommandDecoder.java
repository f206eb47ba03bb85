package com.questrail.hostbridge.codec;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.command.CommandRequest;

import java.time.Instant;

/**
 * Decodes exactly one complete message into a {@link CommandRequest}.
 *
 * <p>The payload must be a whole message: one UDP datagram, or one object
 * already delimited by the TCP framer. Partial input is a decode failure.</p>
 */
public interface CommandDecoder
{
    /**
     * @param payload    raw message bytes (UTF-8 JSON)
     * @param transport  transport the message arrived on
     * @param receivedAt wall-clock arrival time, for observability
     * @throws CommandDecodeException if the payload is not a valid request
     */
    CommandRequest decode(byte[] payload, Transport transport, Instant receivedAt);
}
