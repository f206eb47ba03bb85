package com.questrail.hostbridge.model;

/**
 * Taxonomy of client-visible failures.
 */
public enum ErrorKind
{
    /** Malformed or oversized wire message. */
    PARSE_ERROR("parse_error"),

    /** Name not present in the classification table. */
    UNKNOWN_COMMAND("unknown_command"),

    /** Known command, but not permitted on the transport it arrived on. */
    TRANSPORT_NOT_ALLOWED("transport_not_allowed"),

    /** The host adapter failed the operation. */
    HOST_ERROR("host_error"),

    /** The TCP caller gave up waiting for the outcome. */
    TIMEOUT("timeout"),

    /** The bridge is shutting down and did not execute the command. */
    UNAVAILABLE("unavailable");

    private final String wireName;

    ErrorKind(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }
}
