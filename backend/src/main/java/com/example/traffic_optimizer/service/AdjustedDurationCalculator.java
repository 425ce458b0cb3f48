package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.TransportModeProfile;
import com.example.traffic_optimizer.exception.InvalidModeProfileException;
import com.example.traffic_optimizer.service.dto.AdjustedDuration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 이동수단 + 혼잡 배수 → 보정 소요시간.
 * 입력이 같으면 결과도 같다. 시간대 영향은 배수 인자로만 들어온다.
 */
@Slf4j
@Component
public class AdjustedDurationCalculator {

    static final double SIGNALS_PER_KM = 0.8;
    static final double AVG_SIGNAL_WAIT_MINUTES = 1.0;
    static final double KM_PER_SPEED_BREAKER = 2.0;
    static final double SPEED_BREAKER_MINUTES = 5 / 60.0;

    public AdjustedDuration computeAdjustedDuration(double baseDistanceKm, double baseDurationMinutes,
                                                    TransportModeProfile modeProfile, double trafficMultiplier) {
        validateProfile(modeProfile);
        if (baseDistanceKm < 0 || Double.isNaN(baseDistanceKm)) {
            throw new IllegalArgumentException("baseDistanceKm must be >= 0: " + baseDistanceKm);
        }
        if (trafficMultiplier < 0 || Double.isNaN(trafficMultiplier)) {
            throw new IllegalArgumentException("trafficMultiplier must be >= 0: " + trafficMultiplier);
        }

        // 1. 이동수단별 경로 길이
        double adjustedDistance = baseDistanceKm * modeProfile.getDistanceMultiplier();

        // 2. 평균 속도 기준 주행 시간
        double duration = (adjustedDistance / modeProfile.getAverageSpeedKmh()) * 60;

        // 3. 혼잡 영향 수단만 배수 적용
        if (modeProfile.isTrafficAffected()) {
            duration *= trafficMultiplier;
        }

        // 4~5. 신호 대기
        long intersectionCount = (long) Math.ceil(adjustedDistance * SIGNALS_PER_KM);
        double trafficLightMinutes = intersectionCount * AVG_SIGNAL_WAIT_MINUTES * modeProfile.getSignalWaitMultiplier();
        duration += trafficLightMinutes;

        // 6. 과속방지턱
        double speedBreakerMinutes = (adjustedDistance / KM_PER_SPEED_BREAKER) * SPEED_BREAKER_MINUTES;
        duration += speedBreakerMinutes;

        double effectiveSpeed = duration > 0 ? adjustedDistance / (duration / 60) : 0;

        AdjustedDuration result = AdjustedDuration.builder()
                .mode(modeProfile.getMode() != null ? modeProfile.getMode().getCode() : null)
                .baseDistanceKm(baseDistanceKm)
                .baseDurationMinutes(baseDurationMinutes)
                .trafficMultiplier(trafficMultiplier)
                .adjustedDistanceKm(round1(adjustedDistance))
                .adjustedDurationMinutes(Math.round(duration))
                .effectiveSpeedKmh(round1(effectiveSpeed))
                .trafficLightMinutes(Math.round(trafficLightMinutes))
                .intersectionCount(intersectionCount)
                .speedBreakerMinutes(round1(speedBreakerMinutes))
                .build();

        log.debug("Adjusted duration {}km x{} ({}) -> {}min", baseDistanceKm, trafficMultiplier,
                result.getMode(), result.getAdjustedDurationMinutes());
        return result;
    }

    private void validateProfile(TransportModeProfile profile) {
        if (profile == null) {
            throw new InvalidModeProfileException("Transport mode profile is missing");
        }
        String mode = profile.getMode() != null ? profile.getMode().getCode() : "unknown";
        if (!(profile.getAverageSpeedKmh() > 0)) {
            throw new InvalidModeProfileException(mode, "averageSpeedKmh must be > 0 but was " + profile.getAverageSpeedKmh());
        }
        if (!(profile.getDistanceMultiplier() > 0)) {
            throw new InvalidModeProfileException(mode, "distanceMultiplier must be > 0 but was " + profile.getDistanceMultiplier());
        }
        if (!(profile.getSignalWaitMultiplier() > 0)) {
            throw new InvalidModeProfileException(mode, "signalWaitMultiplier must be > 0 but was " + profile.getSignalWaitMultiplier());
        }
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
