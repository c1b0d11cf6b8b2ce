package com.arrowcontrol.controller.messaging;

import com.arrowcontrol.controller.domain.events.CommandResultEvent;
import com.arrowcontrol.controller.domain.events.ConnectionEvent;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.domain.events.PeerDiscoveredEvent;
import com.arrowcontrol.controller.domain.events.PeerLostEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Operator-facing log of every controller state change.
 */
@Slf4j
@Component
public class ControllerEventLogger {

    @EventListener
    public void onDeviceEvent(DeviceEvent event) {
        switch (event.kind()) {
            case REGISTERED -> log.info("📝 Device registered: {}", event.deviceId());
            case UPDATED -> {
                if (event.previousId() != null) {
                    log.info("🔄 Device {} re-registered as {}", event.previousId(), event.deviceId());
                } else {
                    log.debug("🔄 Device updated: {}", event.deviceId());
                }
            }
            case CONNECTED -> log.info("🔌 Device connected: {} (status={})", event.deviceId(), event.status());
            case DISCONNECTED -> log.info("📴 Device disconnected: {}", event.deviceId());
            case PAIRED -> log.info("🤝 Device paired: {}", event.deviceId());
            case UNPAIRED -> log.info("💔 Device unpaired: {}", event.deviceId());
            case REMOVED -> log.info("🗑️ Device removed: {}", event.deviceId());
        }
    }

    @EventListener
    public void onConnectionEvent(ConnectionEvent event) {
        log.debug("🔗 Connection {} {} from {} (device={})",
                event.connectionId(), event.kind(), event.remoteAddress(), event.deviceId());
    }

    @EventListener
    public void onCommandResult(CommandResultEvent event) {
        if (event.success()) {
            log.info("✅ Command {} executed on {}", event.commandType(), event.deviceId());
        } else {
            log.warn("❌ Command {} failed on {}: {}", event.commandType(), event.deviceId(), event.error());
        }
    }

    @EventListener
    public void onPeerDiscovered(PeerDiscoveredEvent event) {
        log.info("📡 Discovered peer {} ({})", event.ip(),
                event.deviceInfo() != null ? event.deviceInfo().getName() : "unknown");
    }

    @EventListener
    public void onPeerLost(PeerLostEvent event) {
        log.info("👻 Lost peer {} ({}), last heard {}", event.ip(),
                event.deviceInfo() != null ? event.deviceInfo().getName() : "unknown", event.lastSeen());
    }
}
