package com.questrail.hostbridge.codec;

/**
 * Indicates that a complete wire message could not be translated into a
 * {@link com.questrail.hostbridge.command.CommandRequest}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not valid JSON</li>
 *   <li>A JSON value that is not an object</li>
 *   <li>A missing, non-string, or blank {@code "type"}</li>
 *   <li>A {@code "params"} value that is not an object</li>
 * </ul>
 */
public final class CommandDecodeException extends RuntimeException
{
    public CommandDecodeException(String message) {
        super(message);
    }

    public CommandDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
