package com.questrail.hostbridge.transport;

import java.net.SocketAddress;

/**
 * One accepted TCP connection, as seen above the endpoint.
 *
 * <p>Writes may be issued from any thread; the endpoint serializes them onto
 * the socket. Writing to a closed connection is a silent no-op.</p>
 */
public interface StreamConnection
{
    /**
     * Stable identifier for logs.
     */
    String id();

    SocketAddress remoteAddress();

    boolean isOpen();

    void write(byte[] payload);

    /**
     * Stop reading from the socket until {@link #resumeReading()}. Frames
     * already read may still be delivered.
     */
    void pauseReading();

    void resumeReading();

    void close();
}
