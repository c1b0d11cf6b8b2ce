package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.application.ports.ControllerEventPublisher;
import com.arrowcontrol.controller.config.ControlServerProperties;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.model.RegisteredDevice;
import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.util.TokenGenerator;
import com.arrowcontrol.protocol.util.Tokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Authoritative record of every target this controller has seen.
 *
 * <p>All operations are serialized on the registry monitor and return copies, so callers never observe or
 * mutate a record outside the lock. Expected failures come back as results, never as exceptions.
 */
@Slf4j
@Service
public class DeviceRegistry {

    private final Map<String, RegisteredDevice> devices = new HashMap<>();
    private final Map<String, String> devicesByIp = new HashMap<>();
    private final Map<String, String> devicesByMac = new HashMap<>();

    private final TokenGenerator tokenGenerator;
    private final Clock clock;
    private final ControllerEventPublisher eventPublisher;
    private final Duration pairingTokenTtl;

    public DeviceRegistry(TokenGenerator tokenGenerator, Clock clock, ControllerEventPublisher eventPublisher,
                          ControlServerProperties properties) {
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.pairingTokenTtl = properties.pairingTokenTtl();
    }

    // ==================== Registration ====================

    /**
     * Upserts a device by id. An unknown id whose ip (checked first) or mac matches an existing record takes
     * that record over instead of creating a duplicate.
     */
    public synchronized Registration registerDevice(DeviceInfo info) {
        Instant now = clock.instant();

        RegisteredDevice existing = devices.get(info.getId());
        if (existing != null) {
            unindex(existing);
            existing.setInfo(merge(existing.getInfo(), info));
            existing.setLastSeen(now);
            refreshPairingTokenIfStale(existing, now);
            index(existing);
            log.debug("🔄 Updated device {}", info.getId());
            publish(DeviceEvent.Kind.UPDATED, existing, null);
            return new Registration(existing.snapshot(), false, null);
        }

        RegisteredDevice previous = findRecordByAddress(info);
        if (previous != null) {
            String previousId = previous.getId();
            unindex(previous);
            devices.remove(previousId);
            previous.setInfo(merge(previous.getInfo(), info));
            previous.setLastSeen(now);
            refreshPairingTokenIfStale(previous, now);
            devices.put(info.getId(), previous);
            index(previous);
            log.info("🔄 Device {} migrated to new id {}", previousId, info.getId());
            publish(DeviceEvent.Kind.UPDATED, previous, previousId);
            return new Registration(previous.snapshot(), false, previousId);
        }

        RegisteredDevice device = RegisteredDevice.builder()
                .info(info)
                .status(ConnectionStatus.DISCONNECTED)
                .firstSeen(now)
                .lastSeen(now)
                .paired(false)
                .pairingToken(tokenGenerator.generate())
                .pairingExpiration(now.plus(pairingTokenTtl))
                .build();
        devices.put(info.getId(), device);
        index(device);
        log.info("📝 Registered new device {} ({}) at {}, pairing token {}",
                info.getId(), info.getName(), info.getIp(), Tokens.mask(device.getPairingToken()));
        publish(DeviceEvent.Kind.REGISTERED, device, null);
        return new Registration(device.snapshot(), true, null);
    }

    // ==================== Connectivity ====================

    public synchronized Optional<RegisteredDevice> connectDevice(String deviceId, String connectionId) {
        RegisteredDevice device = devices.get(deviceId);
        if (device == null) {
            log.warn("⚠️ Cannot connect unknown device {}", deviceId);
            return Optional.empty();
        }
        device.setStatus(device.isPaired() ? ConnectionStatus.PAIRED : ConnectionStatus.CONNECTED);
        device.setConnectionId(connectionId);
        device.setLastSeen(clock.instant());
        publish(DeviceEvent.Kind.CONNECTED, device, null);
        return Optional.of(device.snapshot());
    }

    /**
     * Pairing survives a disconnect; connectivity does not.
     */
    public synchronized Optional<RegisteredDevice> disconnectDevice(String deviceId) {
        RegisteredDevice device = devices.get(deviceId);
        if (device == null) {
            log.warn("⚠️ Cannot disconnect unknown device {}", deviceId);
            return Optional.empty();
        }
        device.setStatus(ConnectionStatus.DISCONNECTED);
        device.setConnectionId(null);
        device.setLastSeen(clock.instant());
        publish(DeviceEvent.Kind.DISCONNECTED, device, null);
        return Optional.of(device.snapshot());
    }

    public synchronized boolean touchDevice(String deviceId) {
        RegisteredDevice device = devices.get(deviceId);
        if (device == null) {
            return false;
        }
        device.setLastSeen(clock.instant());
        return true;
    }

    // ==================== Pairing ====================

    public synchronized PairingResult pairDevice(String deviceId, String pairingToken) {
        RegisteredDevice device = devices.get(deviceId);
        if (device == null) {
            return PairingResult.failed(PairingResult.DEVICE_NOT_FOUND);
        }
        if (device.getPairingToken() == null) {
            return PairingResult.failed(PairingResult.PAIRING_NOT_SUPPORTED);
        }
        if (!Tokens.matches(device.getPairingToken(), pairingToken)) {
            log.warn("🔐 Invalid pairing token from device {}", deviceId);
            return PairingResult.failed(PairingResult.INVALID_TOKEN);
        }
        Instant now = clock.instant();
        if (device.getPairingExpiration() != null && now.isAfter(device.getPairingExpiration())) {
            log.warn("⏰ Expired pairing token from device {}", deviceId);
            return PairingResult.failed(PairingResult.TOKEN_EXPIRED);
        }

        device.setAuthToken(tokenGenerator.generate());
        device.setPaired(true);
        device.setPairingToken(null);
        device.setPairingExpiration(null);
        device.setLastSeen(now);
        if (device.getStatus() == ConnectionStatus.CONNECTED) {
            device.setStatus(ConnectionStatus.PAIRED);
        }
        publish(DeviceEvent.Kind.PAIRED, device, null);
        return PairingResult.paired(device.snapshot());
    }

    /**
     * Revokes the auth token and issues a fresh pairing token.
     */
    public synchronized PairingResult unpairDevice(String deviceId) {
        RegisteredDevice device = devices.get(deviceId);
        if (device == null) {
            return PairingResult.failed(PairingResult.DEVICE_NOT_FOUND);
        }
        Instant now = clock.instant();
        device.setPaired(false);
        device.setAuthToken(null);
        device.setPairingToken(tokenGenerator.generate());
        device.setPairingExpiration(now.plus(pairingTokenTtl));
        if (device.getStatus() == ConnectionStatus.PAIRED) {
            device.setStatus(ConnectionStatus.CONNECTED);
        }
        publish(DeviceEvent.Kind.UNPAIRED, device, null);
        return new PairingResult(true, device.snapshot(), null);
    }

    // ==================== Removal ====================

    public synchronized boolean removeDevice(String deviceId) {
        RegisteredDevice device = devices.remove(deviceId);
        if (device == null) {
            return false;
        }
        unindex(device);
        publish(DeviceEvent.Kind.REMOVED, device, null);
        return true;
    }

    /**
     * Removes every device whose last activity is older than {@code maxAge}. Devices still bound to a live
     * connection are kept; they leave the registry only after their session ends.
     *
     * @return number of devices removed
     */
    public synchronized int cleanupOldDevices(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        Iterator<RegisteredDevice> iterator = devices.values().iterator();
        while (iterator.hasNext()) {
            RegisteredDevice device = iterator.next();
            if (device.getConnectionId() == null && device.getLastSeen().isBefore(cutoff)) {
                iterator.remove();
                unindex(device);
                publish(DeviceEvent.Kind.REMOVED, device, null);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("🧹 Removed {} stale devices (max age {})", removed, maxAge);
        }
        return removed;
    }

    // ==================== Queries ====================

    public synchronized Optional<RegisteredDevice> getDevice(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId)).map(RegisteredDevice::snapshot);
    }

    public synchronized Optional<RegisteredDevice> findByIp(String ip) {
        return Optional.ofNullable(devicesByIp.get(ip)).flatMap(this::getDevice);
    }

    public synchronized Optional<RegisteredDevice> findByMac(String mac) {
        return Optional.ofNullable(devicesByMac.get(mac)).flatMap(this::getDevice);
    }

    public synchronized Optional<RegisteredDevice> findByConnectionId(String connectionId) {
        return devices.values().stream()
                .filter(device -> connectionId.equals(device.getConnectionId()))
                .findFirst()
                .map(RegisteredDevice::snapshot);
    }

    public synchronized List<RegisteredDevice> getAllDevices() {
        return select(device -> true);
    }

    public synchronized List<RegisteredDevice> getConnectedDevices() {
        return select(device -> device.getStatus().isOnline());
    }

    public synchronized List<RegisteredDevice> getPairedDevices() {
        return select(device -> device.isPaired() && device.getStatus() == ConnectionStatus.PAIRED);
    }

    public synchronized int size() {
        return devices.size();
    }

    // ==================== Internals ====================

    private List<RegisteredDevice> select(Predicate<RegisteredDevice> filter) {
        List<RegisteredDevice> result = new ArrayList<>();
        for (RegisteredDevice device : devices.values()) {
            if (filter.test(device)) {
                result.add(device.snapshot());
            }
        }
        return result;
    }

    private RegisteredDevice findRecordByAddress(DeviceInfo info) {
        if (info.getIp() != null) {
            String byIp = devicesByIp.get(info.getIp());
            if (byIp != null) {
                return devices.get(byIp);
            }
        }
        if (info.getMac() != null) {
            String byMac = devicesByMac.get(info.getMac());
            if (byMac != null) {
                return devices.get(byMac);
            }
        }
        return null;
    }

    // An unpaired device that registers again after its token lapsed gets a fresh one.
    private void refreshPairingTokenIfStale(RegisteredDevice device, Instant now) {
        if (device.isPaired()) {
            return;
        }
        boolean expired = device.getPairingExpiration() != null && now.isAfter(device.getPairingExpiration());
        if (device.getPairingToken() == null || expired) {
            device.setPairingToken(tokenGenerator.generate());
            device.setPairingExpiration(now.plus(pairingTokenTtl));
        }
    }

    private void index(RegisteredDevice device) {
        DeviceInfo info = device.getInfo();
        if (info.getIp() != null) {
            devicesByIp.put(info.getIp(), info.getId());
        }
        if (info.getMac() != null) {
            devicesByMac.put(info.getMac(), info.getId());
        }
    }

    private void unindex(RegisteredDevice device) {
        DeviceInfo info = device.getInfo();
        if (info.getIp() != null) {
            devicesByIp.remove(info.getIp(), info.getId());
        }
        if (info.getMac() != null) {
            devicesByMac.remove(info.getMac(), info.getId());
        }
    }

    private static DeviceInfo merge(DeviceInfo current, DeviceInfo update) {
        DeviceInfo.DeviceInfoBuilder builder = current.toBuilder().id(update.getId());
        if (update.getName() != null) {
            builder.name(update.getName());
        }
        if (update.getIp() != null) {
            builder.ip(update.getIp());
        }
        if (update.getMac() != null) {
            builder.mac(update.getMac());
        }
        if (update.getType() != null) {
            builder.type(update.getType());
        }
        if (update.getSupportedCommands() != null) {
            builder.supportedCommands(update.getSupportedCommands());
        }
        return builder.build();
    }

    private void publish(DeviceEvent.Kind kind, RegisteredDevice device, String previousId) {
        eventPublisher.publishDeviceEvent(new DeviceEvent(kind, device.getId(), previousId, device.getStatus(),
                device.isPaired(), clock.instant()));
    }
}
