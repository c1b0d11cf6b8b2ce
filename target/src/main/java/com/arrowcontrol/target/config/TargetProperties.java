package com.arrowcontrol.target.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

//* Immutable target agent configuration.
// deviceId – stable id of this target, blank = random per run
// deviceName – display name, blank = ArrowTarget-<id prefix>
// controllerHost – controller address, blank = wait for a discovery announce
// controllerPort – controller WebSocket port (default: 8080)
// autoReconnect – reconnect with exponential backoff after an unexpected close (default: true)
// autoAcceptPairing – answer a pairing token without asking the operator (default: false)
// heartbeatInterval – keep-alive period while connected (default: 30s)
// reconnectBaseDelay / reconnectMaxDelay – backoff floor and cap (default: 1s / 30s)
// maxReconnectAttempts – attempts before giving up (default: 10)
// keySimulator – robot (real key events) or logging (default: logging)
// discoveryEnabled – listen for controller announces (default: true)
// discoveryPort – UDP port announces arrive on (default: 8081)
// controllerDiscoveryPort – UDP port the register broadcast is sent to (default: 3000)
// pairingPrompt – ask on the console before pairing (default: true)
@ConfigurationProperties(prefix = "arrow-control.target")
public record TargetProperties(
    String deviceId,
    String deviceName,
    String controllerHost,
    @DefaultValue("8080") int controllerPort,
    @DefaultValue("true") boolean autoReconnect,
    @DefaultValue("false") boolean autoAcceptPairing,
    @DefaultValue("30s") Duration heartbeatInterval,
    @DefaultValue("1s") Duration reconnectBaseDelay,
    @DefaultValue("30s") Duration reconnectMaxDelay,
    @DefaultValue("10") int maxReconnectAttempts,
    @DefaultValue("logging") KeySimulator keySimulator,
    @DefaultValue("true") boolean discoveryEnabled,
    @DefaultValue("8081") int discoveryPort,
    @DefaultValue("3000") int controllerDiscoveryPort,
    @DefaultValue("true") boolean pairingPrompt,
    @DefaultValue("65536") int maxFrameSize
) {

    public enum KeySimulator {
        ROBOT,
        LOGGING
    }

    public TargetProperties {
        requirePort(controllerPort, "Controller port");
        requirePort(discoveryPort, "Discovery port");
        requirePort(controllerDiscoveryPort, "Controller discovery port");
        requirePositive(heartbeatInterval, "Heartbeat interval");
        requirePositive(reconnectBaseDelay, "Reconnect base delay");
        requirePositive(reconnectMaxDelay, "Reconnect max delay");
        if (reconnectMaxDelay.compareTo(reconnectBaseDelay) < 0) {
            throw new IllegalArgumentException("Reconnect max delay must not be below the base delay");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("Max reconnect attempts cannot be negative");
        }
        if (maxFrameSize < 1024) {
            throw new IllegalArgumentException("Max frame size must be at least 1024 bytes");
        }
        if (keySimulator == null) {
            keySimulator = KeySimulator.LOGGING;
        }
    }

    public static TargetProperties defaults() {
        return new TargetProperties(null, null, null, 8080, true, false, Duration.ofSeconds(30),
                Duration.ofSeconds(1), Duration.ofSeconds(30), 10, KeySimulator.LOGGING, true, 8081, 3000, true, 65536);
    }

    public boolean hasControllerHost() {
        return controllerHost != null && !controllerHost.isBlank();
    }

    private static void requirePort(int port, String name) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
