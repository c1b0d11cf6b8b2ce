package com.arrowcontrol.controller.controller;

import com.arrowcontrol.controller.dto.ApiResponse;
import com.arrowcontrol.controller.dto.DiscoveredPeerDto;
import com.arrowcontrol.controller.model.DiscoveredPeer;
import com.arrowcontrol.controller.service.DeviceRegistry;
import com.arrowcontrol.controller.service.DiscoveredPeerTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/discovery")
@Tag(name = "Discovery", description = "Targets heard on the discovery port")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveredPeerTracker peerTracker;
    private final DeviceRegistry deviceRegistry;

    @GetMapping("/peers")
    @Operation(summary = "List discovered peers")
    public ResponseEntity<ApiResponse<List<DiscoveredPeerDto>>> listPeers() {
        List<DiscoveredPeerDto> peers = peerTracker.getPeers().stream()
                .map(this::toDto)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(peers));
    }

    private DiscoveredPeerDto toDto(DiscoveredPeer peer) {
        String deviceId = peer.deviceInfo() != null ? peer.deviceInfo().getId() : null;
        String name = peer.deviceInfo() != null ? peer.deviceInfo().getName() : null;
        boolean registered = deviceId != null && deviceRegistry.getDevice(deviceId).isPresent();
        return new DiscoveredPeerDto(peer.ip(), deviceId, name, registered, peer.firstSeen(), peer.lastSeen());
    }
}
