package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.TransportModeProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransportModeResponse {

    private String code;
    private String displayName;
    private double averageSpeedKmh;
    private double distanceMultiplier;
    private boolean trafficAffected;
    private double signalWaitMultiplier;

    public static TransportModeResponse from(TransportModeProfile profile) {
        return TransportModeResponse.builder()
                .code(profile.getMode().getCode())
                .displayName(profile.getMode().getDisplayName())
                .averageSpeedKmh(profile.getAverageSpeedKmh())
                .distanceMultiplier(profile.getDistanceMultiplier())
                .trafficAffected(profile.isTrafficAffected())
                .signalWaitMultiplier(profile.getSignalWaitMultiplier())
                .build();
    }
}
