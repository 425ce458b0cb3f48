package com.example.traffic_optimizer.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustedDuration {

    private String mode;
    private double baseDistanceKm;
    private double baseDurationMinutes;
    private double trafficMultiplier;

    private double adjustedDistanceKm;
    private long adjustedDurationMinutes;
    private double effectiveSpeedKmh;

    // 추가 시간 내역
    private long trafficLightMinutes;
    private long intersectionCount;
    private double speedBreakerMinutes;
}
