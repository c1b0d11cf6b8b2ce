package com.arrowcontrol.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveredPeerDto(String ip, String deviceId, String name, boolean registered,
                                Instant firstSeen, Instant lastSeen) {
}
