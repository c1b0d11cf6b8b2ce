package com.arrowcontrol.controller.dto;

import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Operator view of a registered device. Secrets are never exposed.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceDto {

    private String id;
    private String name;
    private String ip;
    private String mac;
    private DeviceType type;
    private Set<String> supportedCommands;
    private ConnectionStatus status;
    private boolean paired;
    private Instant firstSeen;
    private Instant lastSeen;
}
