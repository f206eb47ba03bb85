package com.questrail.hostbridge.observability;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.model.CommandResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HostBridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements HostBridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onCommandExecuted(CommandExecutionEvent event) {
        if (event.outcome() instanceof CommandResponse.Failure failure) {
            log.warn("#{} {} via {} failed: {}",
                event.sequence(),
                event.command().name(),
                event.command().transport(),
                failure.message());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("#{} {} via {} ok (queued {} us, executed {} us)",
                event.sequence(),
                event.command().name(),
                event.command().transport(),
                event.queueWait().toNanos() / 1_000,
                event.execution().toNanos() / 1_000);
        }
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        // TCP clients get an error envelope; UDP senders get nothing, so make the drop visible.
        if (event.transport() == Transport.UDP) {
            log.warn("Dropped UDP datagram from {} ({}): {}",
                event.remote(), event.kind().wireName(), event.reason());
        }
        else {
            log.debug("Rejected TCP request from {} ({}): {}",
                event.remote(), event.kind().wireName(), event.reason());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.warn("{} {} {}", event.transport(), event.kind(), event.address(), event.cause());
        }
        else {
            log.info("{} {} {}", event.transport(), event.kind(), event.address());
        }
    }

    @Override
    public void onError(HostBridgeErrorEvent event) {
        log.error("Host bridge error: {}", event.message(), event.cause());
    }
}
