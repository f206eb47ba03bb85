package com.questrail.hostbridge.transport.udp;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.codec.CommandDecodeException;
import com.questrail.hostbridge.codec.CommandDecoder;
import com.questrail.hostbridge.command.CommandRequest;
import com.questrail.hostbridge.dispatch.CommandDispatcher;
import com.questrail.hostbridge.internal.time.WallClock;
import com.questrail.hostbridge.observability.HostBridgeObservabilitySink;
import com.questrail.hostbridge.observability.NullObservabilitySink;
import com.questrail.hostbridge.observability.TransportObservabilityEvent;
import com.questrail.hostbridge.transport.DatagramEndpoint;
import com.questrail.hostbridge.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * UdpTransportAdapter
 * =============================================================================
 * Fire-and-forget channel: one datagram, one command, no reply.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → CommandDecoder
 *            → CommandDispatcher.fireAndForget
 *                → ExecutionSerializer queue
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class never writes to the sender. Undecodable datagrams, unknown
 * commands and commands that require TCP are dropped; the drop is visible
 * only through observability. Nothing here waits on the host, so a slow host
 * never stalls the receive loop beyond the cost of a queue insert.
 */
public class UdpTransportAdapter implements DatagramEndpointListener {

    private final CommandDispatcher dispatcher;
    private final DatagramEndpoint endpoint;
    private final CommandDecoder decoder;
    private final WallClock wallClock;
    private final HostBridgeObservabilitySink observabilitySink;

    public UdpTransportAdapter(CommandDispatcher dispatcher,
                               DatagramEndpoint endpoint,
                               CommandDecoder decoder,
                               WallClock wallClock,
                               HostBridgeObservabilitySink observabilitySink) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.UDP, TransportObservabilityEvent.Kind.UP, endpoint.localAddress(), null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.UDP, TransportObservabilityEvent.Kind.DOWN, null, cause));
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        final CommandRequest request;
        try {
            request = decoder.decode(payload, Transport.UDP, wallClock.now());
        } catch (CommandDecodeException e) {
            dispatcher.rejectMalformed(Transport.UDP, e.getMessage(), remote);
            return;
        }

        dispatcher.fireAndForget(request, remote);
    }
}
