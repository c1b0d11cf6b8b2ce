package com.arrowcontrol.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArrowCommandRequest {

    @NotBlank(message = "deviceId is required")
    @Schema(description = "Target device id", example = "3f0c6a4e-target")
    private String deviceId;

    @NotBlank(message = "direction is required")
    @Pattern(regexp = "(?i)left|right", message = "direction must be left or right")
    @Schema(description = "Arrow direction", example = "left")
    private String direction;

    @Positive(message = "repeat must be a positive integer")
    @Schema(description = "Number of taps", defaultValue = "1")
    private Integer repeat;

    @PositiveOrZero(message = "holdTime must be a non-negative integer")
    @Schema(description = "Milliseconds each press is held", defaultValue = "0")
    private Integer holdTime;
}
