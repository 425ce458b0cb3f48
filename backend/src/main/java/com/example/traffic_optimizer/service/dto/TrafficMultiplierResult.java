package com.example.traffic_optimizer.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrafficMultiplierResult {

    public static final double NO_CITY_DATA_MULTIPLIER = 1.2;
    public static final String NO_CITY_DATA_FACTOR = "no city data";

    private double multiplier;

    // 적용 순서: 첨두 → 주말 → 축제 → 공사
    private List<String> contributingFactors;

    private boolean cityDataAvailable;

    public static TrafficMultiplierResult noCityData() {
        return TrafficMultiplierResult.builder()
                .multiplier(NO_CITY_DATA_MULTIPLIER)
                .contributingFactors(List.of(NO_CITY_DATA_FACTOR))
                .cityDataAvailable(false)
                .build();
    }
}
