package com.arrowcontrol.target;

import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.target.client.ControlClient;
import com.arrowcontrol.target.config.TargetProperties;
import com.arrowcontrol.target.discovery.ControllerDiscoveryListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the agent: discovery first, then a direct connect when a controller host is configured.
 */
@Slf4j
@Component
public class TargetRunner implements ApplicationRunner {

    private final ControlClient client;
    private final TargetProperties properties;
    private final ObjectProvider<ControllerDiscoveryListener> discoveryListener;

    public TargetRunner(ControlClient client, TargetProperties properties,
                        ObjectProvider<ControllerDiscoveryListener> discoveryListener) {
        this.client = client;
        this.properties = properties;
        this.discoveryListener = discoveryListener;
    }

    @Override
    public void run(ApplicationArguments args) {
        DeviceInfo device = client.getDeviceInfo();
        log.info("🎯 Target {} ({}) at {} supports {}", device.getName(), device.getId(), device.getIp(),
                device.getSupportedCommands());
        log.info("📊 Target configuration: autoReconnect={}, autoAcceptPairing={}, keySimulator={}, heartbeat={}",
                properties.autoReconnect(), properties.autoAcceptPairing(), properties.keySimulator(),
                properties.heartbeatInterval());

        discoveryListener.ifAvailable(ControllerDiscoveryListener::start);

        if (properties.hasControllerHost()) {
            client.connect(properties.controllerHost(), properties.controllerPort());
        } else if (properties.discoveryEnabled()) {
            log.info("📡 No controller host configured, waiting for an announce on UDP {}", properties.discoveryPort());
        } else {
            log.warn("⚠️ No controller host configured and discovery is disabled; nothing to connect to");
        }
    }
}
