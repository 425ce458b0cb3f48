package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.CityTrafficProfile;
import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.repository.RegionProfileRegistry;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 도시, 시각, 요일, 월 → 혼잡 배수.
 * 각 단계가 누적 배수에 곱해지며 적용된 요인을 순서대로 기록한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrafficMultiplierCalculator {

    static final double NIGHT_FACTOR = 0.6;
    static final double WEEKEND_FACTOR = 0.7;
    static final double FESTIVAL_WEIGHT = 0.3;
    static final double CONSTRUCTION_FACTOR = 1.15;
    static final double CONSTRUCTION_DELAY_THRESHOLD_MINUTES = 10;

    private final RegionProfileRegistry regionProfileRegistry;

    /**
     *  현재 스냅샷 기준 계산
     */
    public TrafficMultiplierResult computeMultiplier(String city, int hour, int dayOfWeek, int month) {
        return computeMultiplier(regionProfileRegistry.current(), city, hour, dayOfWeek, month);
    }

    /**
     *  dayOfWeek: 0 = 일요일 … 6 = 토요일
     */
    public TrafficMultiplierResult computeMultiplier(RegionProfileStore store, String city,
                                                     int hour, int dayOfWeek, int month) {
        validateRange("hour", hour, 0, 23);
        validateRange("dayOfWeek", dayOfWeek, 0, 6);
        validateRange("month", month, 1, 12);

        Optional<CityTrafficProfile> profile = store.getCityProfile(city);
        if (profile.isEmpty()) {
            log.warn("No traffic profile for city '{}', using neutral multiplier", city);
            return TrafficMultiplierResult.noCityData();
        }

        double multiplier = 1.0;
        List<String> factors = new ArrayList<>();

        // 1. 첨두 / 야간
        CityTrafficProfile.PeakWindow morning = profile.get().getPeakHours().getMorning();
        CityTrafficProfile.PeakWindow evening = profile.get().getPeakHours().getEvening();
        if (morning.contains(hour)) {
            multiplier *= morning.factor();
            factors.add("Morning peak hour");
        } else if (evening.contains(hour)) {
            multiplier *= evening.factor();
            factors.add("Evening peak hour");
        } else if (isNight(hour)) {
            multiplier *= NIGHT_FACTOR;
            factors.add("Night time - light traffic");
        }

        // 2. 주말 (첨두와 중복 적용)
        if (isWeekend(dayOfWeek)) {
            multiplier *= WEEKEND_FACTOR;
            factors.add("Weekend - reduced traffic");
        }

        // 3. 축제 (원 배수의 30%만 반영)
        List<FestivalPattern> festivals = store.getUpcomingFestivals(month);
        if (!festivals.isEmpty()) {
            double avgFestivalMultiplier = festivals.stream()
                    .mapToDouble(FestivalPattern::getTrafficMultiplier)
                    .average()
                    .orElse(1.0);
            multiplier *= 1 + (avgFestivalMultiplier - 1) * FESTIVAL_WEIGHT;
            factors.add("Festival season: " + festivals.stream()
                    .map(FestivalPattern::getName)
                    .collect(Collectors.joining(", ")));
        }

        // 4. 공사 구간
        List<ConstructionZone> constructions = store.getActiveConstructionZones(profile.get().getName());
        if (!constructions.isEmpty()) {
            double avgDelay = constructions.stream()
                    .mapToInt(ConstructionZone::getDelayMinutes)
                    .average()
                    .orElse(0);
            if (avgDelay > CONSTRUCTION_DELAY_THRESHOLD_MINUTES) {
                multiplier *= CONSTRUCTION_FACTOR;
                factors.add("Active construction: " + constructions.stream()
                        .map(ConstructionZone::getLocation)
                        .collect(Collectors.joining(", ")));
            }
        }

        double rounded = round2(multiplier);
        log.debug("Traffic multiplier city={}, hour={}, dayOfWeek={}, month={} -> {} {}",
                city, hour, dayOfWeek, month, rounded, factors);

        return TrafficMultiplierResult.builder()
                .multiplier(rounded)
                .contributingFactors(List.copyOf(factors))
                .cityDataAvailable(true)
                .build();
    }

    static boolean isNight(int hour) {
        return hour >= 22 || hour <= 5;
    }

    static boolean isWeekend(int dayOfWeek) {
        return dayOfWeek == 0 || dayOfWeek == 6;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static void validateRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be within " + min + "-" + max + ": " + value);
        }
    }
}
