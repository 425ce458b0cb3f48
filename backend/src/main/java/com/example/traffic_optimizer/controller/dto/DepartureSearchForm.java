package com.example.traffic_optimizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DepartureSearchForm {

    @NotBlank
    private String originCity;
    @NotBlank
    private String destinationCity;
    @NotBlank
    private String mode;
    @NotNull
    @PositiveOrZero
    @Max(20000)
    private Double baseDistanceKm;
    @PositiveOrZero
    private double baseDurationMinutes;

    @Min(1)
    @Max(96)
    private Integer horizonSlots;
    @Min(5)
    @Max(240)
    private Integer slotMinutes;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm[:ss]")
    private LocalDateTime now;
}
