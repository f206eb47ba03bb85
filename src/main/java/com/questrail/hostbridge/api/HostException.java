package com.questrail.hostbridge.api;

/**
 * Raised by a {@link HostApi} when an operation fails inside the host.
 *
 * <p>The message is surfaced verbatim to TCP clients inside an error envelope,
 * so it should be human-readable.</p>
 */
public class HostException extends Exception
{
    public HostException(String message) {
        super(message);
    }

    public HostException(String message, Throwable cause) {
        super(message, cause);
    }
}
