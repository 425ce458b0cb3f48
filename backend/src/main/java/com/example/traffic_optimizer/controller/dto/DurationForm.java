package com.example.traffic_optimizer.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DurationForm {

    @NotBlank
    private String mode;
    @NotNull
    @PositiveOrZero
    @Max(20000)
    private Double baseDistanceKm;
    @PositiveOrZero
    private double baseDurationMinutes;
    @NotNull
    @PositiveOrZero
    private Double trafficMultiplier;
}
