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
public class TripEstimateResponse {

    private String originCity;
    private String destinationCity;
    private String mode;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm")
    private LocalDateTime departureTime;

    private RouteLeg baseRoute;

    // 현재 출발 기준
    private TrafficMultiplierResult traffic;
    private TrafficLevel trafficLevel;
    private AdjustedDuration estimate;

    private DepartureSearchResponse departures;
    private RouteIntelligenceResponse intelligence;

    // 선택 항목, 수치 결과와 무관
    private ReasoningAnnotation reasoning;

    private String regionDataVersion;
}
