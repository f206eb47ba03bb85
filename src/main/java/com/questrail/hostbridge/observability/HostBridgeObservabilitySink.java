package com.questrail.hostbridge.observability;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from transport threads and from the execution serializer
 * thread concurrently. Implementations must be thread-safe and must not block.</p>
 */
public interface HostBridgeObservabilitySink {
    /**
     * Called by the execution serializer after every host invocation.
     * @param event the executed command and its outcome
     */
    void onCommandExecuted(CommandExecutionEvent event);

    /**
     * Called when an inbound message is refused before reaching the host
     * (malformed, unknown, not allowed on its transport, or not admitted).
     * @param event the rejection details
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when a transport-level event occurs (listener up/down, connection open/close).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(HostBridgeErrorEvent event);
}
