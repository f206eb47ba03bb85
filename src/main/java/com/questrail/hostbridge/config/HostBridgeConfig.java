package com.questrail.hostbridge.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for the host bridge runtime.
 *
 * <p>Port {@code 0} asks the OS for an ephemeral port. When the UDP port is
 * not set explicitly it follows the TCP port ({@code tcpPort + 1}, or
 * ephemeral when TCP is ephemeral).</p>
 */
public record HostBridgeConfig(
    String bindHost,
    int tcpPort,
    int udpPort,
    Duration responseTimeout,
    Duration shutdownGracePeriod,
    int maxMessageBytes,
    int maxDatagramBytes,
    int maxPendingRequests
) {
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final int DEFAULT_TCP_PORT = 9877;
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 1024 * 1024;
    public static final int DEFAULT_MAX_DATAGRAM_BYTES = 2048;
    public static final int DEFAULT_MAX_PENDING_REQUESTS = 32;

    public static final String ENV_BIND_HOST = "HOST_BRIDGE_BIND_HOST";
    public static final String ENV_TCP_PORT = "HOST_BRIDGE_TCP_PORT";
    public static final String ENV_UDP_PORT = "HOST_BRIDGE_UDP_PORT";

    public HostBridgeConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");

        if (bindHost.isBlank()) {
            throw new IllegalArgumentException("bindHost must not be blank");
        }
        requirePort("tcpPort", tcpPort);
        requirePort("udpPort", udpPort);
        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must not be negative");
        }
        if (maxMessageBytes < 2) {
            throw new IllegalArgumentException("maxMessageBytes must be >= 2");
        }
        if (maxDatagramBytes <= 0) {
            throw new IllegalArgumentException("maxDatagramBytes must be positive");
        }
        if (maxPendingRequests < 1) {
            throw new IllegalArgumentException("maxPendingRequests must be >= 1");
        }
    }

    public InetSocketAddress tcpBindAddress() {
        return new InetSocketAddress(bindHost, tcpPort);
    }

    public InetSocketAddress udpBindAddress() {
        return new InetSocketAddress(bindHost, udpPort);
    }

    public static HostBridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration from {@code HOST_BRIDGE_*} variables, defaults elsewhere.
     *
     * @throws IllegalArgumentException if a variable is set to an unusable value
     */
    public static HostBridgeConfig fromEnvironment(Map<String, String> environment) {
        return builderFromEnvironment(environment).build();
    }

    /**
     * A builder pre-populated from {@code HOST_BRIDGE_*} variables, for callers
     * that layer further overrides on top.
     */
    public static Builder builderFromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");

        Builder builder = builder();
        String host = environment.get(ENV_BIND_HOST);
        if (host != null && !host.isBlank()) {
            builder.withBindHost(host.trim());
        }
        String tcp = environment.get(ENV_TCP_PORT);
        if (tcp != null && !tcp.isBlank()) {
            builder.withTcpPort(parsePort(ENV_TCP_PORT, tcp));
        }
        String udp = environment.get(ENV_UDP_PORT);
        if (udp != null && !udp.isBlank()) {
            builder.withUdpPort(parsePort(ENV_UDP_PORT, udp));
        }
        return builder;
    }

    private static int parsePort(String variable, String value) {
        final int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " is not a port number: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(variable + " is out of range: " + value);
        }
        return port;
    }

    private static void requirePort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be in [0, 65535]: " + port);
        }
    }

    public static final class Builder {
        private String bindHost = DEFAULT_BIND_HOST;
        private int tcpPort = DEFAULT_TCP_PORT;
        private Integer udpPort;
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private Duration shutdownGracePeriod = DEFAULT_SHUTDOWN_GRACE_PERIOD;
        private int maxMessageBytes = DEFAULT_MAX_MESSAGE_BYTES;
        private int maxDatagramBytes = DEFAULT_MAX_DATAGRAM_BYTES;
        private int maxPendingRequests = DEFAULT_MAX_PENDING_REQUESTS;

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withTcpPort(int tcpPort) {
            this.tcpPort = tcpPort;
            return this;
        }

        public Builder withUdpPort(int udpPort) {
            this.udpPort = udpPort;
            return this;
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder withShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        public Builder withMaxMessageBytes(int maxMessageBytes) {
            this.maxMessageBytes = maxMessageBytes;
            return this;
        }

        public Builder withMaxDatagramBytes(int maxDatagramBytes) {
            this.maxDatagramBytes = maxDatagramBytes;
            return this;
        }

        /**
         * Unanswered requests a single TCP connection may have before its reads are paused.
         */
        public Builder withMaxPendingRequests(int maxPendingRequests) {
            this.maxPendingRequests = maxPendingRequests;
            return this;
        }

        public HostBridgeConfig build() {
            int udp = udpPort != null ? udpPort : (tcpPort == 0 ? 0 : tcpPort + 1);
            return new HostBridgeConfig(
                bindHost,
                tcpPort,
                udp,
                responseTimeout,
                shutdownGracePeriod,
                maxMessageBytes,
                maxDatagramBytes,
                maxPendingRequests);
        }
    }
}
