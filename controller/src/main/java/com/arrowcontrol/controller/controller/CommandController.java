package com.arrowcontrol.controller.controller;

import com.arrowcontrol.controller.dto.ApiResponse;
import com.arrowcontrol.controller.dto.ArrowCommandRequest;
import com.arrowcontrol.controller.dto.CommandResponse;
import com.arrowcontrol.controller.exception.ArrowControlException;
import com.arrowcontrol.controller.service.CommandDispatchResult;
import com.arrowcontrol.controller.service.ControlServer;
import com.arrowcontrol.protocol.model.CommandType;
import com.arrowcontrol.protocol.payload.CommandParameters;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/commands")
@Tag(name = "Commands", description = "Arrow-key commands for paired targets")
@Validated
@RequiredArgsConstructor
public class CommandController {

    private final ControlServer controlServer;

    /**
     * Dispatches an arrow press. Success means the frame was handed to the target's connection; the
     * execution outcome arrives later as a command result.
     */
    @PostMapping("/arrow")
    @Operation(summary = "Send arrow key", description = "Send arrow_left or arrow_right to a paired target")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Command sent"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request or unsupported command"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Device not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Device not connected or not paired")
    })
    public ResponseEntity<ApiResponse<CommandResponse>> sendArrow(@Valid @RequestBody ArrowCommandRequest request) {
        log.info("🎯 Arrow {} requested for device {}", request.getDirection(), request.getDeviceId());

        CommandDispatchResult result = controlServer.sendArrowCommand(request.getDeviceId(), request.getDirection(),
                request.getRepeat(), request.getHoldTime());
        if (!result.sent()) {
            throw ArrowControlException.commandRejected(request.getDeviceId(), result);
        }

        String commandType = CommandType.fromDirection(request.getDirection())
                .map(CommandType::wireName)
                .orElse(request.getDirection());
        CommandResponse response = CommandResponse.builder()
                .deviceId(request.getDeviceId())
                .commandType(commandType)
                .repeat(request.getRepeat() != null ? request.getRepeat() : CommandParameters.DEFAULT_REPEAT)
                .holdTime(request.getHoldTime() != null ? request.getHoldTime() : CommandParameters.DEFAULT_HOLD_TIME)
                .message(result.message())
                .build();
        return ResponseEntity.ok(ApiResponse.success(response, result.message()));
    }
}
