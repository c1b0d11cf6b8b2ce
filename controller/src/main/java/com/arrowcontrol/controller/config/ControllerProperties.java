package com.arrowcontrol.controller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

// Identity this controller announces and stamps on outgoing messages.
// id – stable controller id; blank generates a random UUID at startup
// name – human readable name; blank becomes "ArrowController-<first 8 id chars>"
@ConfigurationProperties(prefix = "arrow-control.controller")
public record ControllerProperties(
    @DefaultValue("") String id,
    @DefaultValue("") String name
) {
}
