package com.example.traffic_optimizer.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionDataStatsResponse {

    private String version;
    private int totalCities;
    private int totalInfrastructureProjects;
    private long metroProjects;
    private long flyovers;
    private long expressways;
    private int totalBusRoutes;
    private int totalDevelopmentZones;
    private int totalFestivalPatterns;
    private long activeConstructionZones;
    private int historicalDataPoints;
    private int weatherPatterns;
}
