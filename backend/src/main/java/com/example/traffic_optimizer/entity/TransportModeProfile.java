package com.example.traffic_optimizer.entity;

import com.example.traffic_optimizer.entity.enumclass.TransportMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TransportModeProfile {

    private TransportMode mode;

    private double averageSpeedKmh;

    private double distanceMultiplier;

    private boolean trafficAffected;

    private double signalWaitMultiplier;

    /**
     *  기본 프로필 생성
     */
    public static TransportModeProfile defaultOf(TransportMode mode) {
        return TransportModeProfile.builder()
                .mode(mode)
                .averageSpeedKmh(mode.getAverageSpeedKmh())
                .distanceMultiplier(mode.getDistanceMultiplier())
                .trafficAffected(mode.isTrafficAffected())
                .signalWaitMultiplier(mode.getSignalWaitMultiplier())
                .build();
    }
}
