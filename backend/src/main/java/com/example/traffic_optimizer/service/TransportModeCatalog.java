package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.config.TrafficEngineProperties;
import com.example.traffic_optimizer.entity.TransportModeProfile;
import com.example.traffic_optimizer.entity.enumclass.TransportMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 이동수단 프로필 목록. 기본값 위에 설정값(traffic.engine.modes)을 덮어쓴다.
 * 값 검증은 계산 시점에 하므로 잘못된 설정은 해당 요청만 실패시킨다.
 */
@Slf4j
@Component
public class TransportModeCatalog {

    private final Map<TransportMode, TransportModeProfile> profiles;

    public TransportModeCatalog(TrafficEngineProperties properties) {
        Map<TransportMode, TransportModeProfile> resolved = new EnumMap<>(TransportMode.class);
        for (TransportMode mode : TransportMode.values()) {
            resolved.put(mode, TransportModeProfile.defaultOf(mode));
        }

        properties.getModes().forEach((key, override) -> {
            TransportMode mode = TransportMode.from(key);
            TransportModeProfile.TransportModeProfileBuilder builder = resolved.get(mode).toBuilder();
            if (override.getAverageSpeedKmh() != null) builder.averageSpeedKmh(override.getAverageSpeedKmh());
            if (override.getDistanceMultiplier() != null) builder.distanceMultiplier(override.getDistanceMultiplier());
            if (override.getTrafficAffected() != null) builder.trafficAffected(override.getTrafficAffected());
            if (override.getSignalWaitMultiplier() != null) builder.signalWaitMultiplier(override.getSignalWaitMultiplier());
            resolved.put(mode, builder.build());
            log.info("Transport mode profile overridden: {}", resolved.get(mode));
        });

        this.profiles = Collections.unmodifiableMap(resolved);
    }

    public TransportModeProfile get(TransportMode mode) {
        return profiles.get(mode);
    }

    public TransportModeProfile get(String mode) {
        return get(TransportMode.from(mode));
    }

    public List<TransportModeProfile> getAll() {
        return Arrays.stream(TransportMode.values())
                .map(profiles::get)
                .toList();
    }
}
