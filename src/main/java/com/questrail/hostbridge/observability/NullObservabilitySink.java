package com.questrail.hostbridge.observability;

/**
 * No-op implementation of HostBridgeObservabilitySink.
 */
public final class NullObservabilitySink implements HostBridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommandExecuted(CommandExecutionEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(HostBridgeErrorEvent event) {}
}
