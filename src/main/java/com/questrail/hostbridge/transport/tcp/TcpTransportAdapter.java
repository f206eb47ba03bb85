package com.questrail.hostbridge.transport.tcp;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.codec.CommandDecodeException;
import com.questrail.hostbridge.codec.CommandDecoder;
import com.questrail.hostbridge.codec.ResponseEncoder;
import com.questrail.hostbridge.command.CommandRequest;
import com.questrail.hostbridge.dispatch.CommandDispatcher;
import com.questrail.hostbridge.internal.time.WallClock;
import com.questrail.hostbridge.model.CommandResponse;
import com.questrail.hostbridge.observability.HostBridgeErrorEvent;
import com.questrail.hostbridge.observability.HostBridgeObservabilitySink;
import com.questrail.hostbridge.observability.NullObservabilitySink;
import com.questrail.hostbridge.observability.TransportObservabilityEvent;
import com.questrail.hostbridge.transport.StreamConnection;
import com.questrail.hostbridge.transport.StreamEndpoint;
import com.questrail.hostbridge.transport.StreamEndpointListener;

import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TcpTransportAdapter
 * =============================================================================
 * Request/response channel: every framed message gets exactly one response
 * envelope, written to the connection it came from.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   StreamEndpoint (framed message)
 *        → CommandDecoder            (failure → parse_error envelope)
 *            → CommandDispatcher.request
 *                → ResponseEncoder + '\n'
 *                    → StreamConnection.write
 * </pre>
 *
 * <h2>Per-connection ordering</h2>
 * A connection has at most one request in flight. Each message is chained
 * onto the completion of the previous one, so responses leave in request
 * order and a client pipelining several requests sees them executed in the
 * order sent. No thread ever blocks waiting for the host.
 *
 * <h2>Backpressure</h2>
 * At most {@code maxPendingRequests} messages per connection are waiting or
 * executing. When a connection reaches that depth its reads are paused, and
 * they resume once it has drained to half. A single socket read that was
 * already in progress can still add the frames it contains.
 *
 * <h2>Disconnects</h2>
 * A closed connection drops its chain. Work already queued still executes;
 * its response is discarded. Messages chained behind it are never dispatched.
 */
public class TcpTransportAdapter implements StreamEndpointListener {

    private static final byte[] DELIMITER = {'\n'};

    private final CommandDispatcher dispatcher;
    private final StreamEndpoint endpoint;
    private final CommandDecoder decoder;
    private final ResponseEncoder encoder;
    private final WallClock wallClock;
    private final HostBridgeObservabilitySink observabilitySink;

    private final int maxPendingRequests;
    private final int resumeThreshold;

    private final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();

    public TcpTransportAdapter(CommandDispatcher dispatcher,
                               StreamEndpoint endpoint,
                               CommandDecoder decoder,
                               ResponseEncoder encoder,
                               WallClock wallClock,
                               int maxPendingRequests,
                               HostBridgeObservabilitySink observabilitySink) {
        if (maxPendingRequests < 1) {
            throw new IllegalArgumentException("maxPendingRequests must be >= 1");
        }
        this.maxPendingRequests = maxPendingRequests;
        this.resumeThreshold = maxPendingRequests / 2;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stopAccepting() {
        endpoint.stopAccepting();
    }

    public void stop() {
        endpoint.stop();
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    /**
     * Number of connections with a live request chain.
     */
    public int openConnectionCount() {
        return pipelines.size();
    }

    /**
     * Messages accepted on a connection and not yet answered, or 0 if it is unknown.
     */
    public int pendingRequests(String connectionId) {
        Pipeline pipeline = pipelines.get(connectionId);
        if (pipeline == null) {
            return 0;
        }
        synchronized (pipeline) {
            return pipeline.pending;
        }
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.TCP, TransportObservabilityEvent.Kind.UP, endpoint.localAddress(), null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.TCP, TransportObservabilityEvent.Kind.DOWN, null, cause));
    }

    @Override
    public void onConnectionOpened(StreamConnection connection) {
        pipelines.put(connection.id(), new Pipeline());
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.TCP, TransportObservabilityEvent.Kind.CONNECTION_OPENED,
                connection.remoteAddress(), null));
    }

    @Override
    public void onConnectionClosed(StreamConnection connection, Throwable cause) {
        pipelines.remove(connection.id());
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), Transport.TCP, TransportObservabilityEvent.Kind.CONNECTION_CLOSED,
                connection.remoteAddress(), cause));
    }

    @Override
    public void onMessage(StreamConnection connection, byte[] message) {
        Objects.requireNonNull(message, "message");

        // Decode on the caller's thread; only dispatch waits for the chain.
        final CommandRequest request;
        try {
            request = decoder.decode(message, Transport.TCP, wallClock.now());
        } catch (CommandDecodeException e) {
            CommandResponse.Failure failure =
                    dispatcher.rejectMalformed(Transport.TCP, e.getMessage(), connection.remoteAddress());
            enqueue(connection, () -> CompletableFuture.completedFuture(failure));
            return;
        }

        enqueue(connection, () -> dispatcher.request(request, connection.remoteAddress()));
    }

    @Override
    public void onMalformedMessage(StreamConnection connection, String reason) {
        CommandResponse.Failure failure =
                dispatcher.rejectMalformed(Transport.TCP, reason, connection.remoteAddress());
        enqueue(connection, () -> CompletableFuture.completedFuture(failure));
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private interface Step {
        CompletionStage<CommandResponse> run();
    }

    /**
     * Request chain and backlog of one connection. {@code tail} is only written
     * from the endpoint's callbacks for that connection, which are serial.
     */
    private static final class Pipeline {
        private volatile CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
        private int pending;
        private boolean paused;
    }

    private void enqueue(StreamConnection connection, Step step) {
        Pipeline pipeline = pipelines.get(connection.id());
        if (pipeline == null) {
            return;
        }

        synchronized (pipeline) {
            pipeline.pending++;
            if (!pipeline.paused && pipeline.pending >= maxPendingRequests) {
                pipeline.paused = true;
                connection.pauseReading();
            }
        }

        pipeline.tail = pipeline.tail
                .thenCompose(ignored -> {
                    if (!connection.isOpen()) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return step.run().thenAccept(response -> respond(connection, response));
                })
                .exceptionally(failure -> {
                    observabilitySink.onError(new HostBridgeErrorEvent(
                            wallClock.now(), "Failed to answer request on " + connection.id(), failure));
                    return null;
                })
                .whenComplete((ignored, failure) -> settled(connection, pipeline));
    }

    private void settled(StreamConnection connection, Pipeline pipeline) {
        synchronized (pipeline) {
            pipeline.pending--;
            if (pipeline.paused && pipeline.pending <= resumeThreshold) {
                pipeline.paused = false;
                connection.resumeReading();
            }
        }
    }

    private void respond(StreamConnection connection, CommandResponse response) {
        byte[] body = encoder.encode(response);
        byte[] framed = Arrays.copyOf(body, body.length + DELIMITER.length);
        System.arraycopy(DELIMITER, 0, framed, body.length, DELIMITER.length);
        connection.write(framed);
    }
}
