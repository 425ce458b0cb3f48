package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.BusRoute;
import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.DevelopmentZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import com.example.traffic_optimizer.entity.enumclass.OverallRating;
import com.example.traffic_optimizer.entity.enumclass.PeakHourStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteIntelligenceResponse {

    private String cityName;
    private PeakHourStatus peakHourStatus;
    private OverallRating overallRating;
    private double currentAvgSpeedKmh;
    private List<String> congestionHotspots;

    private List<String> recommendations;
    private String historicalContext;

    private List<InfrastructureUpdate> recentImprovements;
    private List<ConstructionZone> activeConstructions;
    private String infrastructureSummary;

    private List<BusRoute> recommendedBusRoutes;
    private String transitAdvice;

    private List<DevelopmentZone> nearbyDevelopments;
    private String developmentImpact;

    private List<FestivalPattern> upcomingFestivals;
    private List<String> festivalAdvisories;

    private String weatherImpact;
    private List<String> weatherRecommendations;
}
