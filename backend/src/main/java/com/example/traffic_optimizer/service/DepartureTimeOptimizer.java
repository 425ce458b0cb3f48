package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.config.TrafficEngineProperties;
import com.example.traffic_optimizer.entity.TransportModeProfile;
import com.example.traffic_optimizer.entity.enumclass.TrafficLevel;
import com.example.traffic_optimizer.repository.RegionProfileRegistry;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.AdjustedDuration;
import com.example.traffic_optimizer.service.dto.DepartureRecommendation;
import com.example.traffic_optimizer.service.dto.DepartureSlot;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 출발 시각 탐색.
 * now 이후 슬롯 경계부터 일정 간격으로 소요시간을 계산하고, 구간 최소값 대비 지연을 매긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DepartureTimeOptimizer {

    private static final Comparator<DepartureSlot> BY_DELAY_THEN_TIME =
            Comparator.comparingLong(DepartureSlot::getDelayMinutes)
                    .thenComparing(DepartureSlot::getTimestamp);

    private static final Comparator<DepartureSlot> BY_DURATION_THEN_TIME =
            Comparator.comparingLong(DepartureSlot::getEstimatedDurationMinutes)
                    .thenComparing(DepartureSlot::getTimestamp);

    private final TrafficMultiplierCalculator trafficMultiplierCalculator;
    private final AdjustedDurationCalculator adjustedDurationCalculator;
    private final RegionProfileRegistry regionProfileRegistry;
    private final TrafficEngineProperties properties;

    public List<DepartureSlot> findBestDepartures(double baseDistanceKm, double baseDurationMinutes,
                                                  TransportModeProfile modeProfile,
                                                  String originCity, String destinationCity,
                                                  LocalDateTime now) {
        return findBestDepartures(baseDistanceKm, baseDurationMinutes, modeProfile, originCity, destinationCity,
                properties.getHorizonSlots(), properties.getSlotMinutes(), now);
    }

    public List<DepartureSlot> findBestDepartures(double baseDistanceKm, double baseDurationMinutes,
                                                  TransportModeProfile modeProfile,
                                                  String originCity, String destinationCity,
                                                  int horizonSlots, int slotMinutes,
                                                  LocalDateTime now) {
        if (horizonSlots < 1) {
            throw new IllegalArgumentException("horizonSlots must be >= 1: " + horizonSlots);
        }
        if (slotMinutes < 1 || slotMinutes > 1440) {
            throw new IllegalArgumentException("slotMinutes must be within 1-1440: " + slotMinutes);
        }
        if (now == null) {
            throw new IllegalArgumentException("now is required");
        }

        // 탐색 전체에 같은 스냅샷 사용
        RegionProfileStore store = regionProfileRegistry.current();
        LocalDateTime first = nextSlotBoundary(now, slotMinutes);

        // 1. 슬롯별 소요시간
        List<DepartureSlot> slots = new ArrayList<>(horizonSlots);
        for (int i = 0; i < horizonSlots; i++) {
            LocalDateTime sampleTime = first.plusMinutes((long) i * slotMinutes);

            TrafficMultiplierResult traffic = trafficMultiplierCalculator.computeMultiplier(store, originCity,
                    sampleTime.getHour(), dayOfWeekIndex(sampleTime), sampleTime.getMonthValue());
            AdjustedDuration duration = adjustedDurationCalculator.computeAdjustedDuration(
                    baseDistanceKm, baseDurationMinutes, modeProfile, traffic.getMultiplier());

            slots.add(DepartureSlot.builder()
                    .timestamp(sampleTime)
                    .estimatedDurationMinutes(duration.getAdjustedDurationMinutes())
                    .delayMinutes(0)
                    .trafficLevel(TrafficLevel.classify(traffic.getMultiplier()))
                    .trafficMultiplier(traffic.getMultiplier())
                    .build());
        }

        // 2. 최소 소요시간 대비 지연
        long minDuration = slots.stream()
                .mapToLong(DepartureSlot::getEstimatedDurationMinutes)
                .min()
                .orElse(0);
        slots.forEach(slot -> slot.setDelayMinutes(slot.getEstimatedDurationMinutes() - minDuration));

        log.debug("Departure scan {} -> {}: {} slots from {}, min duration {}min",
                originCity, destinationCity, horizonSlots, first, minDuration);
        return slots;
    }

    /**
     *  슬롯 목록 → 지금 출발 / 다음 최적 / 구간 최적
     */
    public DepartureRecommendation recommend(List<DepartureSlot> slots, LocalDateTime now) {
        LocalDateTime leaveNowLimit = now.plusMinutes(properties.getLeaveNowWindowMinutes());
        LocalDateTime nextOptimalLimit = now.plusHours(properties.getNextOptimalWindowHours());

        Optional<DepartureSlot> leaveNow = pick(slots, slot -> !slot.getTimestamp().isAfter(leaveNowLimit),
                BY_DELAY_THEN_TIME);
        Optional<DepartureSlot> nextOptimal = pick(slots, slot -> !slot.getTimestamp().isAfter(nextOptimalLimit),
                BY_DELAY_THEN_TIME);
        Optional<DepartureSlot> absoluteBest = pick(slots, slot -> true, BY_DURATION_THEN_TIME);

        boolean goodToLeaveNow = leaveNow
                .map(slot -> slot.getDelayMinutes() < properties.getGoodToLeaveThresholdMinutes())
                .orElse(false);
        boolean anyTimeIsFine = !slots.isEmpty() && slots.stream().allMatch(slot -> slot.getDelayMinutes() == 0);

        return DepartureRecommendation.builder()
                .leaveNow(leaveNow.orElse(null))
                .goodToLeaveNow(goodToLeaveNow)
                .nextOptimal(nextOptimal.orElse(null))
                .absoluteBest(absoluteBest.orElse(null))
                .anyTimeIsFine(anyTimeIsFine)
                .build();
    }

    /**
     *  다음 슬롯 경계 (정각 슬롯 위라도 다음 경계로)
     */
    static LocalDateTime nextSlotBoundary(LocalDateTime now, int slotMinutes) {
        LocalDateTime truncated = now.truncatedTo(ChronoUnit.MINUTES);
        int minuteOfDay = truncated.getHour() * 60 + truncated.getMinute();
        long next = ((long) minuteOfDay / slotMinutes + 1) * slotMinutes;
        return truncated.truncatedTo(ChronoUnit.DAYS).plusMinutes(next);
    }

    /**
     *  0 = 일요일 … 6 = 토요일
     */
    static int dayOfWeekIndex(LocalDateTime time) {
        return time.getDayOfWeek().getValue() % 7;
    }

    private static Optional<DepartureSlot> pick(List<DepartureSlot> slots, Predicate<DepartureSlot> filter,
                                                Comparator<DepartureSlot> order) {
        return slots.stream().filter(filter).min(order);
    }
}
