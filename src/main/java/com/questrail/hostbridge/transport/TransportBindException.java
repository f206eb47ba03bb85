package com.questrail.hostbridge.transport;

import java.net.SocketAddress;

/**
 * A listening socket could not be bound. Fatal at startup.
 */
public final class TransportBindException extends RuntimeException
{
    private final SocketAddress bindAddress;

    public TransportBindException(SocketAddress bindAddress, Throwable cause) {
        super("Failed to bind " + bindAddress + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.bindAddress = bindAddress;
    }

    public SocketAddress bindAddress() {
        return bindAddress;
    }
}
