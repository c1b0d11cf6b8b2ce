package com.arrowcontrol.controller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

//* Immutable WebSocket control server configuration.
// port – TCP port of the WebSocket endpoint, 0 = ephemeral (default: 8080)
// path – WebSocket upgrade path (default: /)
// bossThreads – threads accepting connections (default: 1)
// workerThreads – I/O threads, 0 = one per CPU core (default: 0)
// backlog – pending connection queue length (default: 1024)
// maxFrameSize – largest accepted WebSocket message in bytes (default: 65536)
// pingInterval – liveness sweep period; a peer missing two consecutive pings is dropped (default: 30s)
// pairingTokenTtl – validity window of an issued pairing token (default: 5m)
// staleDeviceMaxAge – registry records unseen for longer are purged by the maintenance sweep (default: 24h)
@ConfigurationProperties(prefix = "arrow-control.server")
public record ControlServerProperties(
    @DefaultValue("8080") int port,
    @DefaultValue("/") String path,
    @DefaultValue("1") int bossThreads,
    @DefaultValue("0") int workerThreads,
    @DefaultValue("1024") int backlog,
    @DefaultValue("65536") int maxFrameSize,
    @DefaultValue("30s") Duration pingInterval,
    @DefaultValue("5m") Duration pairingTokenTtl,
    @DefaultValue("24h") Duration staleDeviceMaxAge
) {

    // Compact constructor with validation
    public ControlServerProperties {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("WebSocket path must start with '/'");
        }
        if (bossThreads < 1) {
            throw new IllegalArgumentException("Boss threads must be at least 1");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("Worker threads cannot be negative");
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("Backlog must be at least 1");
        }
        if (maxFrameSize < 1024) {
            throw new IllegalArgumentException("Max frame size must be at least 1024 bytes");
        }
        requirePositive(pingInterval, "Ping interval");
        requirePositive(pairingTokenTtl, "Pairing token TTL");
        requirePositive(staleDeviceMaxAge, "Stale device max age");
    }

    public static ControlServerProperties defaults() {
        return new ControlServerProperties(8080, "/", 1, 0, 1024, 65536,
                Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofHours(24));
    }

    /**
     * Get effective worker threads (0 means use available processors)
     */
    public int getEffectiveWorkerThreads() {
        return workerThreads == 0 ? Runtime.getRuntime().availableProcessors() : workerThreads;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
