package com.questrail.hostbridge.api;

import com.questrail.hostbridge.command.CommandKind;

import java.util.Map;

/**
 * HostApi
 * =============================================================================
 * The outward boundary of the bridge: a synchronous, non-reentrant host
 * control surface.
 *
 * <h2>Threading contract</h2>
 * Implementations are assumed to be <strong>neither thread-safe nor
 * reentrant</strong>. The bridge guarantees that {@link #invoke} is only ever
 * called from the single execution serializer thread, one call at a time, in
 * submission order. No other component holds a reference to the host.
 *
 * <p>Calls may block for an arbitrary amount of time. A slow call delays every
 * command queued behind it.</p>
 */
@FunctionalInterface
public interface HostApi
{
    /**
     * Execute one host operation.
     *
     * @param kind       the classified command
     * @param parameters ordered, immutable parameter map (never {@code null})
     * @return structured result; {@code null} is treated as an empty result
     * @throws HostException if the host rejects or fails the operation
     */
    Map<String, Object> invoke(CommandKind kind, Map<String, Object> parameters) throws HostException;
}
