package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.BusRoute;
import com.example.traffic_optimizer.entity.CityTrafficProfile;
import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.DevelopmentZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.entity.HistoricalTrafficRecord;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import com.example.traffic_optimizer.entity.enumclass.OverallRating;
import com.example.traffic_optimizer.entity.enumclass.PeakHourStatus;
import com.example.traffic_optimizer.entity.enumclass.TrafficImpact;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.RouteIntelligenceResponse;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 경로 교통 정보 (첨두 상태, 권장 사항, 인프라/대중교통/개발구역/축제/기상 요약).
 * 스냅샷과 요청 시각만으로 결정된다.
 */
@Slf4j
@Service
public class RouteIntelligenceService {

    static final double DEFAULT_AVG_SPEED_KMH = 25;
    static final double DELAY_ADVICE_THRESHOLD = 1.5;
    static final int NEW_ROUTE_SINCE_YEAR = 2022;
    static final int INFRASTRUCTURE_SINCE_YEAR = 2019;
    static final List<String> FOG_CITIES = List.of("Delhi", "Noida", "Gurgaon", "Lucknow");

    public RouteIntelligenceResponse analyze(RegionProfileStore store, String originCity, String destinationCity,
                                             LocalDateTime time, TrafficMultiplierResult traffic) {
        int hour = time.getHour();
        int month = time.getMonthValue();
        double multiplier = traffic.getMultiplier();

        Optional<CityTrafficProfile> profile = store.getCityProfile(originCity);
        String cityName = profile.map(CityTrafficProfile::getName).orElse(originCity);

        List<ConstructionZone> constructions = store.getActiveConstructionZones(cityName);
        List<FestivalPattern> festivals = store.getUpcomingFestivals(month);
        List<BusRoute> busRoutes = store.getBusRoutes(cityName, null);
        List<DevelopmentZone> developments = store.getDevelopmentZones(cityName);
        List<InfrastructureUpdate> infrastructure = store.getInfrastructureUpdates(cityName, INFRASTRUCTURE_SINCE_YEAR);

        PeakHourStatus peakHourStatus = profile.map(city -> peakHourStatus(city, hour)).orElse(PeakHourStatus.OFF_PEAK);

        List<InfrastructureUpdate> improvements = infrastructure.stream()
                .filter(update -> update.getTrafficImpact() != null && update.getTrafficImpact().isImprovement())
                .toList();

        RouteIntelligenceResponse response = RouteIntelligenceResponse.builder()
                .cityName(cityName)
                .peakHourStatus(peakHourStatus)
                .overallRating(OverallRating.fromMultiplier(multiplier))
                .currentAvgSpeedKmh(profile.map(city -> averageSpeed(city, peakHourStatus)).orElse(DEFAULT_AVG_SPEED_KMH))
                .congestionHotspots(profile.map(city -> firstN(city.getTrafficHotspots(), 5)).orElse(List.of()))
                .recommendations(recommendations(store, cityName, multiplier, constructions))
                .historicalContext(historicalContext(store, cityName))
                .recentImprovements(firstN(improvements, 5))
                .activeConstructions(constructions)
                .infrastructureSummary(infrastructureSummary(improvements, constructions))
                .recommendedBusRoutes(firstN(busRoutes, 3))
                .transitAdvice(transitAdvice(busRoutes))
                .nearbyDevelopments(firstN(developments, 3))
                .developmentImpact(developmentImpact(developments))
                .upcomingFestivals(festivals)
                .festivalAdvisories(festivalAdvisories(festivals))
                .build();

        applyWeather(response, month, originCity, destinationCity);

        log.debug("Route intelligence {} -> {} at {}: {} / {}", originCity, destinationCity, time,
                peakHourStatus.getLabel(), response.getOverallRating().getLabel());
        return response;
    }

    /**
     *  첨두 → 첨두 직전 1시간 → 야간 → 비첨두 순
     */
    static PeakHourStatus peakHourStatus(CityTrafficProfile city, int hour) {
        CityTrafficProfile.PeakWindow morning = city.getPeakHours().getMorning();
        CityTrafficProfile.PeakWindow evening = city.getPeakHours().getEvening();
        if (morning.contains(hour) || evening.contains(hour)) {
            return PeakHourStatus.IN_PEAK;
        }
        if (hour == morning.getStart() - 1 || hour == evening.getStart() - 1) {
            return PeakHourStatus.APPROACHING_PEAK;
        }
        if (TrafficMultiplierCalculator.isNight(hour)) {
            return PeakHourStatus.NIGHT;
        }
        return PeakHourStatus.OFF_PEAK;
    }

    private static double averageSpeed(CityTrafficProfile city, PeakHourStatus status) {
        return switch (status) {
            case IN_PEAK -> city.getAverageSpeed().getPeak();
            case NIGHT -> city.getAverageSpeed().getNight();
            default -> city.getAverageSpeed().getOffPeak();
        };
    }

    private List<String> recommendations(RegionProfileStore store, String cityName, double multiplier,
                                         List<ConstructionZone> constructions) {
        List<String> recommendations = new ArrayList<>();

        if (multiplier > DELAY_ADVICE_THRESHOLD) {
            recommendations.add("Consider delaying travel by 1-2 hours");
            recommendations.add("Use public transport if available");
        }

        if (!constructions.isEmpty()) {
            recommendations.add("Avoid: " + constructions.stream()
                    .map(ConstructionZone::getLocation)
                    .collect(Collectors.joining(", ")));
            LinkedHashSet<String> alternates = constructions.stream()
                    .flatMap(zone -> nullSafe(zone.getAlternateRoutes()).stream())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (!alternates.isEmpty()) {
                recommendations.add("Alternate routes: " + String.join(", ", alternates));
            }
        }

        List<InfrastructureUpdate> newRoutes = store.getInfrastructureUpdates(cityName, NEW_ROUTE_SINCE_YEAR).stream()
                .filter(update -> update.getTrafficImpact() == TrafficImpact.MAJOR_IMPROVEMENT)
                .toList();
        if (!newRoutes.isEmpty()) {
            recommendations.add("Consider new routes: " + newRoutes.stream()
                    .map(InfrastructureUpdate::getName)
                    .collect(Collectors.joining(", ")));
        }

        return recommendations;
    }

    /**
     *  도시 데이터의 최근 2개 연도 중 가장 최근 기록 기준
     */
    String historicalContext(RegionProfileStore store, String cityName) {
        int latestYear = store.getHistoricalData(cityName, Integer.MIN_VALUE, Integer.MAX_VALUE).stream()
                .mapToInt(HistoricalTrafficRecord::getYear)
                .max()
                .orElse(Integer.MIN_VALUE);
        if (latestYear == Integer.MIN_VALUE) {
            return "No historical data available";
        }

        List<HistoricalTrafficRecord> records = store.getHistoricalData(cityName, latestYear - 1, latestYear).stream()
                .sorted(Comparator.comparingInt(HistoricalTrafficRecord::getYear)
                        .thenComparingInt(HistoricalTrafficRecord::getMonth))
                .toList();
        HistoricalTrafficRecord latest = records.get(records.size() - 1);

        Optional<HistoricalTrafficRecord> previousYear = records.stream()
                .filter(record -> record.getYear() == latest.getYear() - 1 && record.getMonth() == latest.getMonth())
                .findFirst();

        if (previousYear.isPresent() && previousYear.get().getAvgSpeedKmh() > 0) {
            double change = (latest.getAvgSpeedKmh() - previousYear.get().getAvgSpeedKmh())
                    / previousYear.get().getAvgSpeedKmh() * 100;
            double rounded = Math.round(change * 10.0) / 10.0;
            return String.format(Locale.ROOT, "Traffic %s by %.1f%% compared to last year",
                    rounded > 0 ? "improved" : "worsened", Math.abs(rounded));
        }
        return String.format(Locale.ROOT, "Average speed in %s: %s km/h, Congestion index: %d/100",
                cityName, formatNumber(latest.getAvgSpeedKmh()), latest.getCongestionIndex());
    }

    private static String infrastructureSummary(List<InfrastructureUpdate> improvements,
                                                List<ConstructionZone> constructions) {
        String summary = "No significant infrastructure changes affecting this route.";
        if (!improvements.isEmpty()) {
            summary = improvements.size() + " recent infrastructure improvements: "
                    + improvements.stream().limit(2).map(InfrastructureUpdate::getName).collect(Collectors.joining(", "))
                    + ". These may provide faster route options.";
        }
        if (!constructions.isEmpty()) {
            summary += " Active construction at "
                    + constructions.stream().map(ConstructionZone::getLocation).collect(Collectors.joining(", "))
                    + " - expect delays.";
        }
        return summary;
    }

    private static String transitAdvice(List<BusRoute> busRoutes) {
        if (busRoutes.isEmpty()) {
            return "No public transit data available for this route.";
        }
        BusRoute bus = busRoutes.get(0);
        int peakMinutes = bus.getFrequency() != null ? bus.getFrequency().getPeakMinutes() : 0;
        return String.format(Locale.ROOT, "Consider %s (%s) running every %d min during peak hours. Route: %s → %s.",
                bus.getRouteNumber(), bus.getType() != null ? bus.getType().name() : "CITY",
                peakMinutes, bus.getStartPoint(), bus.getEndPoint());
    }

    private static String developmentImpact(List<DevelopmentZone> developments) {
        if (developments.isEmpty()) {
            return "No major development zones affecting this route.";
        }
        long totalCommuters = developments.stream().mapToLong(DevelopmentZone::getEstimatedDailyCommuters).sum();
        List<String> peakTimes = nullSafe(developments.get(0).getPeakTrafficTimes());
        return String.format(Locale.ROOT, "%d major development zones nearby with ~%,d daily commuters. Peak impact during %s.",
                developments.size(), totalCommuters, peakTimes.isEmpty() ? "office hours" : String.join(", ", peakTimes));
    }

    private static List<String> festivalAdvisories(List<FestivalPattern> festivals) {
        List<String> advisories = new ArrayList<>();
        for (FestivalPattern festival : festivals) {
            advisories.add(festival.getName() + ": Traffic may be " + formatNumber(festival.getTrafficMultiplier())
                    + "x normal. " + festival.getPeakDays());
            advisories.addAll(firstN(festival.getRecommendations(), 2));
        }
        return advisories;
    }

    /**
     *  6~9월 우기, 11~2월 북부 도시 안개
     */
    private static void applyWeather(RouteIntelligenceResponse response, int month,
                                     String originCity, String destinationCity) {
        if (month >= 6 && month <= 9) {
            response.setWeatherImpact("Monsoon season - expect waterlogging in low-lying areas and reduced visibility during rain.");
            response.setWeatherRecommendations(List.of("Check weather forecast before travel",
                    "Avoid known waterlogging spots", "Allow extra travel time"));
            return;
        }
        boolean fogSeason = month >= 11 || month <= 2;
        if (fogSeason && FOG_CITIES.stream().anyMatch(city -> contains(originCity, city) || contains(destinationCity, city))) {
            response.setWeatherImpact("Winter fog season - morning visibility may be severely reduced. Check for fog warnings.");
            response.setWeatherRecommendations(List.of("Avoid early morning travel (6-9 AM) during fog",
                    "Use fog lights", "Check flight/train status"));
            return;
        }
        response.setWeatherImpact("Normal weather conditions expected.");
        response.setWeatherRecommendations(List.of());
    }

    private static boolean contains(String value, String city) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(city.toLowerCase(Locale.ROOT));
    }

    static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static <T> List<T> firstN(List<T> list, int n) {
        return nullSafe(list).stream().limit(n).toList();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
