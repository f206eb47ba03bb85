package com.questrail.hostbridge.runtime;

import com.questrail.hostbridge.api.HostApi;
import com.questrail.hostbridge.codec.CommandDecoder;
import com.questrail.hostbridge.codec.ResponseEncoder;
import com.questrail.hostbridge.codec.impl.JacksonCommandDecoder;
import com.questrail.hostbridge.codec.impl.JacksonResponseEncoder;
import com.questrail.hostbridge.command.CommandClassifier;
import com.questrail.hostbridge.config.HostBridgeConfig;
import com.questrail.hostbridge.dispatch.CommandDispatcher;
import com.questrail.hostbridge.internal.exec.ExecutionSerializer;
import com.questrail.hostbridge.internal.time.MonotonicClock;
import com.questrail.hostbridge.internal.time.MonotonicScheduler;
import com.questrail.hostbridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.hostbridge.internal.time.SystemMonotonicClock;
import com.questrail.hostbridge.internal.time.SystemWallClock;
import com.questrail.hostbridge.internal.time.WallClock;
import com.questrail.hostbridge.observability.HostBridgeErrorEvent;
import com.questrail.hostbridge.observability.HostBridgeObservabilitySink;
import com.questrail.hostbridge.observability.NullObservabilitySink;
import com.questrail.hostbridge.transport.DatagramEndpoint;
import com.questrail.hostbridge.transport.StreamEndpoint;
import com.questrail.hostbridge.transport.tcp.TcpTransportAdapter;
import com.questrail.hostbridge.transport.tcp.netty.NettyTcpStreamEndpoint;
import com.questrail.hostbridge.transport.udp.UdpTransportAdapter;
import com.questrail.hostbridge.transport.udp.netty.NettyUdpDatagramEndpoint;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * HostBridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the host bridge.
 *
 * <h2>Startup</h2>
 * The serializer starts first, then the TCP listener, then the UDP listener.
 * If a listener fails to bind, everything already started is stopped again
 * and the bind failure propagates.
 *
 * <h2>Shutdown</h2>
 * <ol>
 *   <li>Close the UDP socket (no new fire-and-forget work)</li>
 *   <li>Stop accepting TCP connections</li>
 *   <li>Drain the serializer for up to the grace period; anything still
 *       queued afterwards fails with {@code unavailable}</li>
 *   <li>Close remaining TCP connections and event loops</li>
 *   <li>Stop the timeout scheduler</li>
 * </ol>
 * Open connections can still receive responses for work that finished while
 * draining. {@link #stop()} is idempotent.
 */
public final class HostBridgeRuntime {

    private final HostBridgeConfig config;
    private final ExecutionSerializer serializer;
    private final CommandDispatcher dispatcher;
    private final TcpTransportAdapter tcp;
    private final UdpTransportAdapter udp;
    private final ScheduledExecutorService schedulerExecutor;
    private final WallClock wallClock;
    private final HostBridgeObservabilitySink observabilitySink;

    private final Object lifecycleLock = new Object();
    private boolean started;
    private boolean stopped;

    private HostBridgeRuntime(
            HostBridgeConfig config,
            ExecutionSerializer serializer,
            CommandDispatcher dispatcher,
            TcpTransportAdapter tcp,
            UdpTransportAdapter udp,
            ScheduledExecutorService schedulerExecutor,
            WallClock wallClock,
            HostBridgeObservabilitySink observabilitySink) {
        this.config = config;
        this.serializer = serializer;
        this.dispatcher = dispatcher;
        this.tcp = tcp;
        this.udp = udp;
        this.schedulerExecutor = schedulerExecutor;
        this.wallClock = wallClock;
        this.observabilitySink = observabilitySink;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (started) {
                throw new IllegalStateException("Runtime already started");
            }
            started = true;
        }

        serializer.start();
        try {
            tcp.start();
            udp.start();
        } catch (RuntimeException e) {
            stop();
            throw e;
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
        }

        udp.stop();
        tcp.stopAccepting();

        // Leftovers are failed and reported by the serializer itself.
        serializer.shutdown(config.shutdownGracePeriod());

        tcp.stop();

        schedulerExecutor.shutdownNow();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                observabilitySink.onError(new HostBridgeErrorEvent(
                        wallClock.now(), "Timeout scheduler did not terminate", null));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public SocketAddress tcpAddress() {
        return tcp.localAddress();
    }

    public SocketAddress udpAddress() {
        return udp.localAddress();
    }

    public HostBridgeConfig config() {
        return config;
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    public ExecutionSerializer serializer() {
        return serializer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HostBridgeConfig config = HostBridgeConfig.defaults();
        private HostApi host;
        private HostBridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private CommandClassifier classifier = CommandClassifier.defaultTable();
        private ObjectMapper objectMapper = new ObjectMapper();
        private StreamEndpoint streamEndpoint;
        private DatagramEndpoint datagramEndpoint;

        public Builder withConfig(HostBridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withHost(HostApi host) {
            this.host = host;
            return this;
        }

        public Builder withObservabilitySink(HostBridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClassifier(CommandClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Replace the Netty TCP endpoint, e.g. with an in-memory fake.
         */
        public Builder withStreamEndpoint(StreamEndpoint endpoint) {
            this.streamEndpoint = endpoint;
            return this;
        }

        /**
         * Replace the Netty UDP endpoint, e.g. with an in-memory fake.
         */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        public HostBridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(classifier, "classifier");
            Objects.requireNonNull(objectMapper, "objectMapper");
            HostBridgeObservabilitySink sink =
                    Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "host-bridge-timeouts");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Execution core
            ExecutionSerializer serializer = new ExecutionSerializer(host, clock, wallClock, sink);
            CommandDispatcher dispatcher = new CommandDispatcher(
                classifier,
                serializer,
                scheduler,
                clock,
                wallClock,
                config.responseTimeout(),
                sink
            );

            // 3. Codec
            CommandDecoder decoder = new JacksonCommandDecoder(objectMapper);
            ResponseEncoder encoder = new JacksonResponseEncoder(objectMapper);

            // 4. Transports
            StreamEndpoint stream = streamEndpoint != null
                    ? streamEndpoint
                    : new NettyTcpStreamEndpoint(config.tcpBindAddress(), config.maxMessageBytes());
            DatagramEndpoint datagram = datagramEndpoint != null
                    ? datagramEndpoint
                    : new NettyUdpDatagramEndpoint(config.udpBindAddress(), config.maxDatagramBytes());

            TcpTransportAdapter tcp = new TcpTransportAdapter(
                    dispatcher, stream, decoder, encoder, wallClock, config.maxPendingRequests(), sink);
            UdpTransportAdapter udp = new UdpTransportAdapter(dispatcher, datagram, decoder, wallClock, sink);

            return new HostBridgeRuntime(config, serializer, dispatcher, tcp, udp, schedulerExec, wallClock, sink);
        }
    }
}
