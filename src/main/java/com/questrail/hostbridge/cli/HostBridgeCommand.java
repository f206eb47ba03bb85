package com.questrail.hostbridge.cli;

import com.questrail.hostbridge.config.HostBridgeConfig;
import com.questrail.hostbridge.observability.Slf4jObservabilitySink;
import com.questrail.hostbridge.runtime.HostBridgeRuntime;
import com.questrail.hostbridge.sim.SimulatedSessionHost;
import com.questrail.hostbridge.transport.TransportBindException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point: host-bridge [--bind HOST] [--tcp-port N] [--udp-port N] [--timeout-ms N]
 * <p>
 * Runs the bridge in front of a {@link SimulatedSessionHost} until the JVM is
 * asked to exit. Options override {@code HOST_BRIDGE_*} environment variables,
 * which override the built-in defaults.
 */
@Command(name = "host-bridge", mixinStandardHelpOptions = true, version = "host-bridge 0.1.0",
        description = "Serve TCP and UDP commands against a simulated session host")
public class HostBridgeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HostBridgeCommand.class);

    static final int EXIT_BIND_FAILURE = 2;

    @Option(names = "--bind", description = "Address to bind both listeners to (default: 127.0.0.1)")
    private String bindHost;

    @Option(names = "--tcp-port", description = "TCP request/response port")
    private Integer tcpPort;

    @Option(names = "--udp-port", description = "UDP fire-and-forget port (default: TCP port + 1)")
    private Integer udpPort;

    @Option(names = "--timeout-ms", description = "How long a TCP caller waits for a result, in milliseconds")
    private Long timeoutMillis;

    @Option(names = "--empty-session", description = "Start with no tracks instead of the demo session")
    private boolean emptySession;

    private final Map<String, String> environment;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public HostBridgeCommand() {
        this(System.getenv());
    }

    HostBridgeCommand(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public Integer call() throws Exception {
        HostBridgeConfig config = resolveConfig();
        SimulatedSessionHost host = emptySession ? new SimulatedSessionHost() : SimulatedSessionHost.withDemoSession();

        HostBridgeRuntime runtime = HostBridgeRuntime.builder()
                .withConfig(config)
                .withHost(host)
                .withObservabilitySink(new Slf4jObservabilitySink())
                .build();

        try {
            runtime.start();
        } catch (TransportBindException e) {
            log.error("Could not bind {}", e.bindAddress(), e);
            return EXIT_BIND_FAILURE;
        }

        log.info("Host bridge listening: tcp={} udp={} timeout={}ms",
                runtime.tcpAddress(), runtime.udpAddress(), config.responseTimeout().toMillis());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down host bridge");
            runtime.stop();
            stopped.countDown();
        }, "host-bridge-shutdown"));

        stopped.await();
        return 0;
    }

    /**
     * Defaults, then environment, then command-line options.
     */
    HostBridgeConfig resolveConfig() {
        HostBridgeConfig.Builder builder = HostBridgeConfig.builderFromEnvironment(environment);
        if (bindHost != null) {
            builder.withBindHost(bindHost);
        }
        if (tcpPort != null) {
            builder.withTcpPort(tcpPort);
        }
        if (udpPort != null) {
            builder.withUdpPort(udpPort);
        }
        if (timeoutMillis != null) {
            builder.withResponseTimeout(Duration.ofMillis(timeoutMillis));
        }
        return builder.build();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HostBridgeCommand()).execute(args);
        System.exit(exitCode);
    }
}
