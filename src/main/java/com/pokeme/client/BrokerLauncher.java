package com.pokeme.client;

import com.pokeme.gateway.PokemeApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Path;
import java.util.List;

/** Detects a running broker and starts a detached one when none is listening. */
public class BrokerLauncher {

    private static final Logger log = LoggerFactory.getLogger(BrokerLauncher.class);
    private static final int CONNECT_TIMEOUT_MS = 1000;
    private static final int READY_ATTEMPTS = 50;
    private static final long READY_POLL_MS = 100;

    public static boolean isRunning(int port) {
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), CONNECT_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public void ensureRunning(int port) {
        if (!isRunning(port)) {
            start(port);
        }
    }

    void start(int port) {
        var command = brokerCommand(port);
        try {
            new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new BrokerClientException("failed to start broker: " + e.getMessage(), e);
        }
        for (int i = 0; i < READY_ATTEMPTS; i++) {
            if (isRunning(port)) return;
            try {
                Thread.sleep(READY_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.warn("Broker may not have started on port {}", port);
    }

    static List<String> brokerCommand(int port) {
        var java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java,
                "-cp", System.getProperty("java.class.path"),
                PokemeApp.class.getName(),
                "--server.port=" + port);
    }
}
