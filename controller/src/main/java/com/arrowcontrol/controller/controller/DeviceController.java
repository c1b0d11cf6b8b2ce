package com.arrowcontrol.controller.controller;

import com.arrowcontrol.controller.config.ControlServerProperties;
import com.arrowcontrol.controller.dto.ApiResponse;
import com.arrowcontrol.controller.dto.CleanupResult;
import com.arrowcontrol.controller.dto.DeviceDto;
import com.arrowcontrol.controller.exception.ArrowControlException;
import com.arrowcontrol.controller.mappers.DeviceMapper;
import com.arrowcontrol.controller.model.RegisteredDevice;
import com.arrowcontrol.controller.service.ControlServer;
import com.arrowcontrol.controller.service.DeviceRegistry;
import com.arrowcontrol.controller.service.PairingResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Operator view of the device registry.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/devices")
@Tag(name = "Devices", description = "Registered targets, pairing state and cleanup")
@Validated
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceRegistry deviceRegistry;
    private final ControlServer controlServer;
    private final DeviceMapper deviceMapper;
    private final ControlServerProperties serverProperties;

    @GetMapping
    @Operation(summary = "List devices", description = "All registered devices, or only connected / paired ones")
    public ResponseEntity<ApiResponse<List<DeviceDto>>> listDevices(
            @Parameter(description = "all | connected | paired") @RequestParam(defaultValue = "all") String filter) {

        List<RegisteredDevice> devices = switch (filter.toLowerCase(Locale.ROOT)) {
            case "all" -> deviceRegistry.getAllDevices();
            case "connected" -> deviceRegistry.getConnectedDevices();
            case "paired" -> deviceRegistry.getPairedDevices();
            default -> throw ArrowControlException.badRequest("Unknown filter: " + filter);
        };
        return ResponseEntity.ok(ApiResponse.success(deviceMapper.toDtos(devices)));
    }

    @GetMapping("/{deviceId}")
    @Operation(summary = "Get device")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Device found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown device")
    })
    public ResponseEntity<ApiResponse<DeviceDto>> getDevice(@PathVariable String deviceId) {
        RegisteredDevice device = deviceRegistry.getDevice(deviceId)
                .orElseThrow(() -> ArrowControlException.deviceNotFound(deviceId));
        return ResponseEntity.ok(ApiResponse.success(deviceMapper.toDto(device)));
    }

    @DeleteMapping("/{deviceId}/pairing")
    @Operation(summary = "Unpair device", description = "Revokes the auth token; a connected target is told to pair again")
    public ResponseEntity<ApiResponse<DeviceDto>> unpairDevice(@PathVariable String deviceId) {
        PairingResult result = controlServer.unpairDevice(deviceId);
        if (!result.success()) {
            throw ArrowControlException.deviceNotFound(deviceId);
        }
        log.info("💔 Operator unpaired device {}", deviceId);
        return ResponseEntity.ok(ApiResponse.success(deviceMapper.toDto(result.device()), "Device unpaired"));
    }

    @DeleteMapping("/{deviceId}")
    @Operation(summary = "Remove device", description = "Closes the device session and forgets its record")
    public ResponseEntity<ApiResponse<Void>> removeDevice(@PathVariable String deviceId) {
        if (!controlServer.removeDevice(deviceId)) {
            throw ArrowControlException.deviceNotFound(deviceId);
        }
        log.info("🗑️ Operator removed device {}", deviceId);
        return ResponseEntity.ok(ApiResponse.success(null, "Device removed"));
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Purge stale devices", description = "Removes devices not seen within the given age")
    public ResponseEntity<ApiResponse<CleanupResult>> cleanup(
            @Parameter(description = "Max age in minutes; defaults to the configured stale age")
            @RequestParam(required = false) @Positive Long maxAgeMinutes) {

        Duration maxAge = maxAgeMinutes != null ? Duration.ofMinutes(maxAgeMinutes) : serverProperties.staleDeviceMaxAge();
        int removed = deviceRegistry.cleanupOldDevices(maxAge);
        return ResponseEntity.ok(ApiResponse.success(new CleanupResult(removed, deviceRegistry.size())));
    }
}
