package com.arrowcontrol.protocol;

import java.time.Duration;

/**
 * Wire-level constants shared by controller and target.
 */
public final class ProtocolConstants {

    private ProtocolConstants() {}

    public static final String PROTOCOL_VERSION = "1.0.0";

    // ==================== Ports ====================

    public static final int DEFAULT_CONTROL_PORT = 8080;
    public static final int CONTROLLER_DISCOVERY_PORT = 3000;
    public static final int TARGET_DISCOVERY_PORT = 8081;

    // ==================== Timing ====================

    public static final Duration BROADCAST_INTERVAL = Duration.ofSeconds(5);
    public static final Duration PING_INTERVAL = Duration.ofSeconds(30);
    public static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration PAIRING_TOKEN_TTL = Duration.ofMinutes(5);
    public static final Duration DISCOVERED_PEER_TTL = Duration.ofMinutes(5);

    // ==================== Reconnect ====================

    public static final Duration RECONNECT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration RECONNECT_MAX_DELAY = Duration.ofSeconds(30);
    public static final int MAX_RECONNECT_ATTEMPTS = 10;

    /** Random bytes per pairing/auth token, rendered as twice as many hex characters. */
    public static final int TOKEN_BYTES = 32;
}
