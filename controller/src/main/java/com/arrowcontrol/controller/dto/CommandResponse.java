package com.arrowcontrol.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Local dispatch outcome. Execution on the target is reported asynchronously.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResponse {

    String deviceId;
    String commandType;
    int repeat;
    int holdTime;
    String message;
    @Builder.Default
    Instant sentAt = Instant.now();
}
