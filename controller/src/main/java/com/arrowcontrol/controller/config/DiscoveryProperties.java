package com.arrowcontrol.controller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

//* UDP discovery configuration.
// enabled – broadcast announces and listen for target register broadcasts (default: true)
// port – UDP port this controller binds for target broadcasts, 0 = ephemeral (default: 3000)
// announcePort – UDP port targets listen on for announces (default: 8081)
// broadcastAddress – destination of announces (default: 255.255.255.255)
// broadcastInterval – period between announces (default: 5s)
// peerTtl – how long a discovered but unregistered peer is remembered (default: 5m)
@ConfigurationProperties(prefix = "arrow-control.discovery")
public record DiscoveryProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("3000") int port,
    @DefaultValue("8081") int announcePort,
    @DefaultValue("255.255.255.255") String broadcastAddress,
    @DefaultValue("5s") Duration broadcastInterval,
    @DefaultValue("5m") Duration peerTtl
) {

    public DiscoveryProperties {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Discovery port must be between 0 and 65535");
        }
        if (announcePort <= 0 || announcePort > 65535) {
            throw new IllegalArgumentException("Announce port must be between 1 and 65535");
        }
        if (broadcastInterval == null || broadcastInterval.isZero() || broadcastInterval.isNegative()) {
            throw new IllegalArgumentException("Broadcast interval must be positive");
        }
        if (peerTtl == null || peerTtl.isZero() || peerTtl.isNegative()) {
            throw new IllegalArgumentException("Peer TTL must be positive");
        }
    }

    public static DiscoveryProperties defaults() {
        return new DiscoveryProperties(true, 3000, 8081, "255.255.255.255",
                Duration.ofSeconds(5), Duration.ofMinutes(5));
    }
}
