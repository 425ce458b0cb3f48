package com.example.traffic_optimizer.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 *  지역 교통 데이터 원본 문서
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RegionDataSet {

    private String version;

    private List<CityTrafficProfile> cities;

    private List<FestivalPattern> festivals;

    private List<ConstructionZone> constructionZones;

    private List<InfrastructureUpdate> infrastructureUpdates;

    private List<BusRoute> busRoutes;

    private List<DevelopmentZone> developmentZones;

    private List<HistoricalTrafficRecord> historicalData;

    private List<WeatherImpact> weatherImpacts;
}
