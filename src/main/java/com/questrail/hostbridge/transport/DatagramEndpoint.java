package com.questrail.hostbridge.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Receive-only port for the fire-and-forget UDP channel.
 *
 * <p>There is deliberately no {@code send}: the bridge never answers a
 * datagram.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving datagrams.
     *
     * <p>On success the listener is notified via
     * {@link DatagramEndpointListener#onTransportUp()} before this method returns.</p>
     *
     * @throws TransportBindException if the socket cannot be bound
     */
    void start();

    /**
     * Stop receiving and release all transport resources. Idempotent.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address, or {@code null} when not started.
     */
    SocketAddress localAddress();
}
