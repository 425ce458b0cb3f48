package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.config.TrafficEngineProperties;
import com.example.traffic_optimizer.controller.dto.DepartureSearchForm;
import com.example.traffic_optimizer.controller.dto.DurationForm;
import com.example.traffic_optimizer.controller.dto.TripEstimateForm;
import com.example.traffic_optimizer.entity.TransportModeProfile;
import com.example.traffic_optimizer.entity.enumclass.RouteSource;
import com.example.traffic_optimizer.entity.enumclass.TrafficLevel;
import com.example.traffic_optimizer.exception.RoutingProviderException;
import com.example.traffic_optimizer.repository.RegionProfileRegistry;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.AdjustedDuration;
import com.example.traffic_optimizer.service.dto.DepartureSearchResponse;
import com.example.traffic_optimizer.service.dto.DepartureSlot;
import com.example.traffic_optimizer.service.dto.RouteIntelligenceResponse;
import com.example.traffic_optimizer.service.dto.RouteLeg;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import com.example.traffic_optimizer.service.dto.TripEstimateResponse;
import com.example.traffic_optimizer.util.GeoDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 여정 추정 흐름: 기본 경로 → 현재 출발 추정 → 출발 시각 탐색 → 경로 정보 → (선택) 설명.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripEstimateService {

    private final TransportModeCatalog transportModeCatalog;
    private final TrafficMultiplierCalculator trafficMultiplierCalculator;
    private final AdjustedDurationCalculator adjustedDurationCalculator;
    private final DepartureTimeOptimizer departureTimeOptimizer;
    private final RouteIntelligenceService routeIntelligenceService;
    private final TrafficReasoningService trafficReasoningService;
    private final RoutingClient routingClient;
    private final RegionProfileRegistry regionProfileRegistry;
    private final TrafficEngineProperties properties;
    private final Clock regionClock;

    /**
     *  1. 전체 여정 추정
     */
    public TripEstimateResponse estimate(TripEstimateForm form) {
        TransportModeProfile modeProfile = transportModeCatalog.get(form.getMode());
        RegionProfileStore store = regionProfileRegistry.current();
        LocalDateTime departureTime = form.getDepartureTime() != null
                ? form.getDepartureTime()
                : LocalDateTime.now(regionClock).truncatedTo(ChronoUnit.MINUTES);

        log.info("Trip estimate requested: {} -> {} by {} at {}", form.getOriginCity(),
                form.getDestinationCity(), modeProfile.getMode().getCode(), departureTime);

        // 1. 기본 거리/시간 (스코어링 전에 1회만)
        RouteLeg baseRoute = resolveBaseRoute(form, modeProfile, store);

        // 2. 지금 출발 기준
        TrafficMultiplierResult traffic = trafficMultiplierCalculator.computeMultiplier(store, form.getOriginCity(),
                departureTime.getHour(), DepartureTimeOptimizer.dayOfWeekIndex(departureTime),
                departureTime.getMonthValue());
        AdjustedDuration estimate = adjustedDurationCalculator.computeAdjustedDuration(
                baseRoute.getDistanceKm(), baseRoute.getDurationMinutes(), modeProfile, traffic.getMultiplier());

        // 3. 출발 시각 탐색
        int horizonSlots = form.getHorizonSlots() != null ? form.getHorizonSlots() : properties.getHorizonSlots();
        int slotMinutes = form.getSlotMinutes() != null ? form.getSlotMinutes() : properties.getSlotMinutes();
        DepartureSearchResponse departures = scan(baseRoute.getDistanceKm(), baseRoute.getDurationMinutes(),
                modeProfile, form.getOriginCity(), form.getDestinationCity(), horizonSlots, slotMinutes, departureTime);

        // 4. 경로 정보
        RouteIntelligenceResponse intelligence = routeIntelligenceService.analyze(store, form.getOriginCity(),
                form.getDestinationCity(), departureTime, traffic);

        TripEstimateResponse response = TripEstimateResponse.builder()
                .originCity(form.getOriginCity())
                .destinationCity(form.getDestinationCity())
                .mode(modeProfile.getMode().getCode())
                .departureTime(departureTime)
                .baseRoute(baseRoute)
                .traffic(traffic)
                .trafficLevel(TrafficLevel.classify(traffic.getMultiplier()))
                .estimate(estimate)
                .departures(departures)
                .intelligence(intelligence)
                .regionDataVersion(store.getVersion())
                .build();

        // 5. 설명 (수치 계산 이후, 결과와 독립)
        if (form.isIncludeReasoning()) {
            response.setReasoning(trafficReasoningService.annotate(response));
        }

        log.info("Trip estimate {} -> {}: {}min (x{}, {}), base from {}", form.getOriginCity(),
                form.getDestinationCity(), estimate.getAdjustedDurationMinutes(), traffic.getMultiplier(),
                response.getTrafficLevel().getLabel(), baseRoute.getSource());
        return response;
    }

    /**
     *  2. 보정 소요시간만 계산
     */
    public AdjustedDuration computeDuration(DurationForm form) {
        TransportModeProfile modeProfile = transportModeCatalog.get(form.getMode());
        return adjustedDurationCalculator.computeAdjustedDuration(form.getBaseDistanceKm(),
                form.getBaseDurationMinutes(), modeProfile, form.getTrafficMultiplier());
    }

    /**
     *  3. 출발 시각 탐색만 수행
     */
    public DepartureSearchResponse searchDepartures(DepartureSearchForm form) {
        TransportModeProfile modeProfile = transportModeCatalog.get(form.getMode());
        LocalDateTime now = form.getNow() != null
                ? form.getNow()
                : LocalDateTime.now(regionClock).truncatedTo(ChronoUnit.MINUTES);
        int horizonSlots = form.getHorizonSlots() != null ? form.getHorizonSlots() : properties.getHorizonSlots();
        int slotMinutes = form.getSlotMinutes() != null ? form.getSlotMinutes() : properties.getSlotMinutes();

        return scan(form.getBaseDistanceKm(), form.getBaseDurationMinutes(), modeProfile,
                form.getOriginCity(), form.getDestinationCity(), horizonSlots, slotMinutes, now);
    }

    private DepartureSearchResponse scan(double distanceKm, double durationMinutes, TransportModeProfile modeProfile,
                                         String originCity, String destinationCity,
                                         int horizonSlots, int slotMinutes, LocalDateTime now) {
        List<DepartureSlot> slots = departureTimeOptimizer.findBestDepartures(distanceKm, durationMinutes,
                modeProfile, originCity, destinationCity, horizonSlots, slotMinutes, now);

        return DepartureSearchResponse.builder()
                .originCity(originCity)
                .destinationCity(destinationCity)
                .mode(modeProfile.getMode().getCode())
                .requestedAt(now)
                .horizonSlots(horizonSlots)
                .slotMinutes(slotMinutes)
                .slots(slots)
                .recommendation(departureTimeOptimizer.recommend(slots, now))
                .build();
    }

    /**
     *  호출자 값 → 경로 제공자 → 대권 거리 순
     */
    RouteLeg resolveBaseRoute(TripEstimateForm form, TransportModeProfile modeProfile, RegionProfileStore store) {
        if (form.getBaseDistanceKm() != null) {
            double duration = form.getBaseDurationMinutes() != null
                    ? form.getBaseDurationMinutes()
                    : speedDerivedMinutes(form.getBaseDistanceKm(), modeProfile);
            return RouteLeg.builder()
                    .distanceKm(form.getBaseDistanceKm())
                    .durationMinutes(duration)
                    .source(RouteSource.CALLER)
                    .build();
        }

        Optional<double[]> origin = coordinates(form.getOriginLat(), form.getOriginLng(), form.getOriginCity(), store);
        Optional<double[]> destination = coordinates(form.getDestinationLat(), form.getDestinationLng(),
                form.getDestinationCity(), store);
        if (origin.isEmpty() || destination.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive base distance: provide baseDistanceKm or coordinates for "
                    + (origin.isEmpty() ? form.getOriginCity() : form.getDestinationCity()));
        }

        try {
            return routingClient.route(origin.get()[0], origin.get()[1],
                    destination.get()[0], destination.get()[1], modeProfile.getMode());
        } catch (RoutingProviderException e) {
            log.warn("Routing provider unavailable, using great-circle distance: {}", e.getMessage());
        }

        double distanceKm = GeoDistance.haversineKm(origin.get()[0], origin.get()[1],
                destination.get()[0], destination.get()[1]);
        return RouteLeg.builder()
                .distanceKm(Math.round(distanceKm * 10.0) / 10.0)
                .durationMinutes(speedDerivedMinutes(distanceKm, modeProfile))
                .source(RouteSource.GREAT_CIRCLE_FALLBACK)
                .build();
    }

    private static Optional<double[]> coordinates(Double lat, Double lng, String cityName, RegionProfileStore store) {
        if (lat != null && lng != null) {
            return Optional.of(new double[]{lat, lng});
        }
        return store.getCityProfile(cityName)
                .map(city -> new double[]{city.getLat(), city.getLng()});
    }

    private static double speedDerivedMinutes(double distanceKm, TransportModeProfile modeProfile) {
        if (!(modeProfile.getAverageSpeedKmh() > 0)) {
            return 0;
        }
        return Math.round(distanceKm / modeProfile.getAverageSpeedKmh() * 60 * 10.0) / 10.0;
    }
}
