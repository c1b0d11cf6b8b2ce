package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.config.ControlServerProperties;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.support.MutableClock;
import com.arrowcontrol.controller.support.RecordingEventPublisher;
import com.arrowcontrol.controller.support.SequentialTokenGenerator;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryMaintenanceTest {

    private MutableClock clock;
    private RecordingEventPublisher events;
    private DeviceRegistry registry;
    private RegistryMaintenance maintenance;

    @BeforeEach
    void setUp() {
        ControlServerProperties properties = ControlServerProperties.defaults();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        events = new RecordingEventPublisher();
        registry = new DeviceRegistry(new SequentialTokenGenerator(), clock, events, properties);
        maintenance = new RegistryMaintenance(registry, properties);
    }

    private void register(String id) {
        registry.registerDevice(DeviceInfo.builder().id(id).name(id).type(DeviceType.TARGET).build());
    }

    @Test
    void sweepPurgesDevicesOlderThanMaxAge() {
        register("old");
        clock.advance(Duration.ofHours(20));
        register("recent");
        clock.advance(Duration.ofHours(5));

        maintenance.purgeStaleDevices();

        assertThat(registry.getDevice("old")).isEmpty();
        assertThat(registry.getDevice("recent")).isPresent();
        assertThat(events.count(DeviceEvent.Kind.REMOVED, "old")).isEqualTo(1);
    }

    @Test
    void sweepKeepsConnectedDevices() {
        register("bound");
        registry.connectDevice("bound", "conn-1");
        clock.advance(Duration.ofDays(2));

        maintenance.purgeStaleDevices();

        assertThat(registry.getDevice("bound")).isPresent();
        assertThat(registry.size()).isEqualTo(1);
    }
}
