package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import com.example.traffic_optimizer.entity.enumclass.InfrastructureType;
import com.example.traffic_optimizer.exception.CityNotFoundException;
import com.example.traffic_optimizer.repository.RegionProfileRegistry;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.CityProfileResponse;
import com.example.traffic_optimizer.service.dto.RegionDataStatsResponse;
import com.example.traffic_optimizer.service.dto.RegionSearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * 지역 기준 데이터 조회/검색/통계
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegionDataService {

    private final RegionProfileRegistry regionProfileRegistry;

    public List<CityProfileResponse> getCities() {
        return regionProfileRegistry.current().getCities().stream()
                .map(CityProfileResponse::from)
                .toList();
    }

    public CityProfileResponse getCity(String name) {
        return regionProfileRegistry.current().getCityProfile(name)
                .map(CityProfileResponse::from)
                .orElseThrow(() -> new CityNotFoundException(name));
    }

    public List<ConstructionZone> getActiveConstructionZones(String city) {
        return regionProfileRegistry.current().getActiveConstructionZones(city);
    }

    public List<FestivalPattern> getUpcomingFestivals(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be within 1-12: " + month);
        }
        return regionProfileRegistry.current().getUpcomingFestivals(month);
    }

    public List<InfrastructureUpdate> getInfrastructureUpdates(String city, Integer afterYear) {
        return regionProfileRegistry.current().getInfrastructureUpdates(city, afterYear);
    }

    public RegionDataStatsResponse getStats() {
        RegionProfileStore store = regionProfileRegistry.current();
        List<InfrastructureUpdate> infrastructure = store.getInfrastructureUpdates();

        return RegionDataStatsResponse.builder()
                .version(store.getVersion())
                .totalCities(store.getCities().size())
                .totalInfrastructureProjects(infrastructure.size())
                .metroProjects(countType(infrastructure, InfrastructureType.METRO_LINE))
                .flyovers(countType(infrastructure, InfrastructureType.FLYOVER))
                .expressways(countType(infrastructure, InfrastructureType.EXPRESSWAY))
                .totalBusRoutes(store.getBusRoutes().size())
                .totalDevelopmentZones(store.getDevelopmentZones().size())
                .totalFestivalPatterns(store.getFestivals().size())
                .activeConstructionZones(store.getActiveConstructionZones(null).size())
                .historicalDataPoints(store.getHistoricalData().size())
                .weatherPatterns(store.getWeatherImpacts().size())
                .build();
    }

    /**
     *  이름/도시/설명 부분 일치 검색 (대소문자 무시)
     */
    public RegionSearchResponse search(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        RegionProfileStore store = regionProfileRegistry.current();

        return RegionSearchResponse.builder()
                .query(query)
                .cities(store.getCities().stream()
                        .filter(city -> contains(city.getName(), needle) || contains(city.getState(), needle))
                        .map(CityProfileResponse::from)
                        .toList())
                .infrastructure(store.getInfrastructureUpdates().stream()
                        .filter(update -> contains(update.getName(), needle) || contains(update.getCity(), needle)
                                || contains(update.getDescription(), needle))
                        .toList())
                .busRoutes(store.getBusRoutes().stream()
                        .filter(route -> contains(route.getRouteName(), needle) || contains(route.getCity(), needle)
                                || contains(route.getStartPoint(), needle) || contains(route.getEndPoint(), needle))
                        .toList())
                .developments(store.getDevelopmentZones().stream()
                        .filter(zone -> contains(zone.getName(), needle) || contains(zone.getCity(), needle)
                                || contains(zone.getDescription(), needle))
                        .toList())
                .build();
    }

    public RegionDataStatsResponse reload() {
        RegionProfileStore reloaded = regionProfileRegistry.reload();
        log.info("Region data reloaded via API, version {}", reloaded.getVersion());
        return getStats();
    }

    private static long countType(List<InfrastructureUpdate> updates, InfrastructureType type) {
        return updates.stream().filter(update -> update.getType() == type).count();
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
