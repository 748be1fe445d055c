package com.pokeme.client;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class BrokerLauncherTest {

    @Test
    void detectsListeningPort() throws Exception {
        try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            assertTrue(BrokerLauncher.isRunning(server.getLocalPort()));
        }
    }

    @Test
    void detectsClosedPort() throws Exception {
        int port;
        try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        assertFalse(BrokerLauncher.isRunning(port));
    }

    @Test
    void brokerCommandStartsAppOnRequestedPort() {
        var command = BrokerLauncher.brokerCommand(9200);
        assertTrue(command.get(0).endsWith("java"));
        assertTrue(command.contains("com.pokeme.gateway.PokemeApp"));
        assertEquals("--server.port=9200", command.get(command.size() - 1));
    }
}
