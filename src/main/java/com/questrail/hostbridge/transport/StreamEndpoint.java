package com.questrail.hostbridge.transport;

import java.net.SocketAddress;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Port for the reliable request/response TCP channel.
 *
 * <p>The endpoint accepts connections, frames each connection's byte stream
 * into complete messages, and reports them to its listener. It never
 * interprets message contents.</p>
 *
 * <h2>Shutdown in two steps</h2>
 * {@link #stopAccepting()} closes only the listening socket, so responses for
 * work already in flight can still be written. {@link #stop()} then closes
 * every remaining connection.
 */
public interface StreamEndpoint
{
    /**
     * Bind the listening socket and begin accepting connections.
     *
     * @throws TransportBindException if the socket cannot be bound
     */
    void start();

    /**
     * Close the listening socket. Existing connections stay open. Idempotent.
     */
    void stopAccepting();

    /**
     * Close the listening socket and every connection, then release all
     * resources. Idempotent.
     */
    void stop();

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(StreamEndpointListener listener);

    /**
     * The bound local address, or {@code null} when not started.
     */
    SocketAddress localAddress();
}
