package com.questrail.hostbridge.api;

/**
 * The two inbound channels a command can arrive on.
 *
 * <p>{@link #TCP} is the reliable request/response channel; {@link #UDP} is the
 * fire-and-forget channel. TCP is the superset transport: every known command
 * may travel over it.</p>
 */
public enum Transport
{
    TCP,
    UDP
}
