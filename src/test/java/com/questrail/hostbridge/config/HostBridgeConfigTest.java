package com.questrail.hostbridge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HostBridgeConfigTest {

    @Test
    void defaultsMatchTheConventionalPorts() {
        HostBridgeConfig config = HostBridgeConfig.defaults();

        assertEquals("127.0.0.1", config.bindHost());
        assertEquals(9877, config.tcpPort());
        assertEquals(9878, config.udpPort());
        assertEquals(Duration.ofSeconds(10), config.responseTimeout());
        assertEquals(Duration.ofSeconds(5), config.shutdownGracePeriod());
        assertEquals(1024 * 1024, config.maxMessageBytes());
        assertEquals(2048, config.maxDatagramBytes());
        assertEquals(32, config.maxPendingRequests());
    }

    @Test
    void udpPortFollowsTcpPortUnlessSet() {
        assertEquals(7001, HostBridgeConfig.builder().withTcpPort(7000).build().udpPort());
        assertEquals(0, HostBridgeConfig.builder().withTcpPort(0).build().udpPort());
        assertEquals(5000, HostBridgeConfig.builder().withTcpPort(7000).withUdpPort(5000).build().udpPort());
    }

    @Test
    void environmentOverridesDefaults() {
        HostBridgeConfig config = HostBridgeConfig.fromEnvironment(Map.of(
                "HOST_BRIDGE_BIND_HOST", "0.0.0.0",
                "HOST_BRIDGE_TCP_PORT", " 9000 "));

        assertEquals("0.0.0.0", config.bindHost());
        assertEquals(9000, config.tcpPort());
        assertEquals(9001, config.udpPort());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        HostBridgeConfig config = HostBridgeConfig.fromEnvironment(Map.of(
                "HOST_BRIDGE_BIND_HOST", "",
                "HOST_BRIDGE_UDP_PORT", "  "));

        assertEquals(HostBridgeConfig.defaults(), config);
    }

    @Test
    void invalidEnvironmentValuesNameTheVariable() {
        IllegalArgumentException notANumber = assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.fromEnvironment(Map.of("HOST_BRIDGE_TCP_PORT", "abc")));
        assertTrue(notANumber.getMessage().contains("HOST_BRIDGE_TCP_PORT"));

        IllegalArgumentException outOfRange = assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.fromEnvironment(Map.of("HOST_BRIDGE_UDP_PORT", "70000")));
        assertTrue(outOfRange.getMessage().contains("HOST_BRIDGE_UDP_PORT"));
    }

    @Test
    void rejectsUnusableValues() {
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withResponseTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withShutdownGracePeriod(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withTcpPort(65535).build());
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withBindHost(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withMaxDatagramBytes(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> HostBridgeConfig.builder().withMaxPendingRequests(0).build());
    }
}
