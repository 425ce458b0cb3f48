package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.enumclass.RouteSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteLeg {

    private double distanceKm;
    private double durationMinutes;
    private RouteSource source;
}
