package com.arrowcontrol.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Identity a peer advertises about itself. The id is generated once per process lifetime.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceInfo {

    String id;
    String name;
    String ip;
    String mac;
    DeviceType type;
    @Builder.Default
    Set<String> supportedCommands = Set.of();

    public boolean supports(String commandType) {
        return supportedCommands != null && supportedCommands.contains(commandType);
    }

    @JsonIgnore
    public boolean hasIdentity() {
        return id != null && !id.isBlank() && type != null;
    }
}
