package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.config.ControlServerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically purges registry records that have not been seen for the configured max age.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistryMaintenance {

    private final DeviceRegistry registry;
    private final ControlServerProperties properties;

    @Scheduled(fixedDelayString = "${arrow-control.server.stale-sweep-interval-ms:3600000}",
               initialDelayString = "${arrow-control.server.stale-sweep-interval-ms:3600000}")
    public void purgeStaleDevices() {
        int removed = registry.cleanupOldDevices(properties.staleDeviceMaxAge());
        log.debug("🧹 Stale device sweep removed {} records ({} remain)", removed, registry.size());
    }
}
