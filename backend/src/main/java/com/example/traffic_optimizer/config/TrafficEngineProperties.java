package com.example.traffic_optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 교통 엔진 설정 (traffic.engine.*)
 */
@Data
@ConfigurationProperties(prefix = "traffic.engine")
public class TrafficEngineProperties {

    /**
     * 지역 표준 시간대. 출발 시각 계산의 기준.
     */
    private String zoneId = "Asia/Kolkata";

    /**
     * 지역 교통 데이터 위치 (Spring Resource 경로).
     */
    private String dataLocation = "classpath:region/india-traffic-data.json";

    private int horizonSlots = 24;

    private int slotMinutes = 30;

    private int leaveNowWindowMinutes = 15;

    private int nextOptimalWindowHours = 6;

    private int goodToLeaveThresholdMinutes = 5;

    /**
     * 이동수단별 프로필 재정의. 키는 driving, two-wheeler, bus, cycling, walking.
     */
    private Map<String, ModeOverride> modes = new LinkedHashMap<>();

    @Data
    public static class ModeOverride {
        private Double averageSpeedKmh;
        private Double distanceMultiplier;
        private Boolean trafficAffected;
        private Double signalWaitMultiplier;
    }
}
