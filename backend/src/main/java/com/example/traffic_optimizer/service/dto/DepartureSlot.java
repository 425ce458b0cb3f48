package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.enumclass.TrafficLevel;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartureSlot {

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm")
    private LocalDateTime timestamp;

    private long estimatedDurationMinutes;

    // 탐색 구간 최소 소요시간 대비 지연
    private long delayMinutes;

    private TrafficLevel trafficLevel;

    private double trafficMultiplier;
}
