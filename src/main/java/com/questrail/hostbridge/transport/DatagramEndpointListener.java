package com.questrail.hostbridge.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the endpoint (Netty endpoints deliver
 * them on the channel's event loop). Implementations must return quickly: the
 * receive loop does not read the next datagram until the callback returns.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called once the socket is bound.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is exactly one datagram, copied out of any
     * framework-specific buffer. It is never a fragment of a larger message.</p>
     *
     * @param remote  remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
