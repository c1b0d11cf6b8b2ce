package com.arrowcontrol.controller.model;

import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry record of a target. Instances handed out by the registry are snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredDevice {

    private DeviceInfo info;
    private ConnectionStatus status;
    private Instant firstSeen;
    private Instant lastSeen;
    private String connectionId;
    private boolean paired;
    private String pairingToken;
    private Instant pairingExpiration;
    private String authToken;

    public String getId() {
        return info.getId();
    }

    public boolean supports(String commandType) {
        return info.supports(commandType);
    }

    public RegisteredDevice snapshot() {
        return toBuilder().build();
    }
}
