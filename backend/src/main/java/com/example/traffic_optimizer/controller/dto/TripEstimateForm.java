package com.example.traffic_optimizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
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
public class TripEstimateForm {

    @NotBlank
    private String originCity;
    @NotBlank
    private String destinationCity;
    @NotBlank
    private String mode;

    // 없으면 경로 제공자 호출
    @PositiveOrZero
    @Max(20000)
    private Double baseDistanceKm;
    @PositiveOrZero
    private Double baseDurationMinutes;

    private Double originLat;
    private Double originLng;
    private Double destinationLat;
    private Double destinationLng;

    // 지역 표준시 기준, 없으면 현재 시각
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm[:ss]")
    private LocalDateTime departureTime;

    @Min(1)
    @Max(96)
    private Integer horizonSlots;
    @Min(5)
    @Max(240)
    private Integer slotMinutes;

    private boolean includeReasoning;
}
