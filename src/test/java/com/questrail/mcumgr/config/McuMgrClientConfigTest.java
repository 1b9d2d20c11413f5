package com.questrail.mcumgr.config;

import com.questrail.mcumgr.transport.udp.UdpMcuMgrTransport;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class McuMgrClientConfigTest {

    private static final InetSocketAddress DEVICE = new InetSocketAddress("127.0.0.1", 1337);

    @Test
    void builderDefaults() {
        McuMgrClientConfig config = McuMgrClientConfig.builder().withRemoteAddress(DEVICE).build();

        assertEquals(DEVICE, config.remoteAddress());
        assertEquals(0, config.bindAddress().getPort());
        assertEquals(1024, config.mtu());
        assertEquals(McuMgrTimingPolicy.defaults(), config.timingPolicy());
    }

    @Test
    void remoteHostUsesTheDefaultPort() {
        McuMgrClientConfig config = McuMgrClientConfig.builder().withRemoteHost("127.0.0.1").build();

        assertEquals(UdpMcuMgrTransport.DEFAULT_PORT, config.remoteAddress().getPort());
    }

    @Test
    void remoteAddressIsRequired() {
        assertThrows(NullPointerException.class, () -> McuMgrClientConfig.builder().build());
    }

    @Test
    void mtuMustBeInRange() {
        assertThrows(IllegalArgumentException.class, () ->
                McuMgrClientConfig.builder().withRemoteAddress(DEVICE).withMtu(72).build());
        assertThrows(IllegalArgumentException.class, () ->
                McuMgrClientConfig.builder().withRemoteAddress(DEVICE).withMtu(1025).build());
        assertEquals(73, McuMgrClientConfig.builder().withRemoteAddress(DEVICE).withMtu(73).build().mtu());
    }

    @Test
    void timingPolicyDefaults() {
        McuMgrTimingPolicy policy = McuMgrTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(40), policy.defaultTimeout());
        assertEquals(Duration.ofSeconds(5), policy.shutdownGrace());
        assertEquals(Duration.ofSeconds(2), McuMgrTimingPolicy.withDefaultTimeout(Duration.ofSeconds(2)).defaultTimeout());
    }

    @Test
    void timingPolicyRejectsNegativeOrMissingDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                new McuMgrTimingPolicy(Duration.ofMillis(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
                new McuMgrTimingPolicy(Duration.ZERO, Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> new McuMgrTimingPolicy(null, Duration.ZERO));
    }
}
