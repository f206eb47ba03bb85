package com.questrail.hostbridge.transport;

/**
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>For a given connection, callbacks are delivered serially and in stream
 * order. Callbacks for different connections may run concurrently.</p>
 */
public interface StreamEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    void onConnectionOpened(StreamConnection connection);

    /**
     * Called once per complete framed message.
     */
    void onMessage(StreamConnection connection, byte[] message);

    /**
     * Called when the framer discarded bytes it could not turn into a message.
     * The connection stays open.
     */
    void onMalformedMessage(StreamConnection connection, String reason);

    /**
     * Called once when the connection is gone.
     *
     * @param cause the I/O failure that closed it; {@code null} for an orderly close
     */
    void onConnectionClosed(StreamConnection connection, Throwable cause);
}
