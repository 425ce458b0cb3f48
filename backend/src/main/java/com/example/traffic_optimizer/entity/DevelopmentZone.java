package com.example.traffic_optimizer.entity;

import com.example.traffic_optimizer.entity.enumclass.DevelopmentZoneType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class DevelopmentZone {

    private String id;

    private String city;

    private String name;

    private DevelopmentZoneType type;

    private String description;

    private int startYear;

    private Integer completionYear;

    private long estimatedDailyCommuters;

    private List<String> peakTrafficTimes;

    private List<String> nearbyLandmarks;

    private List<String> trafficChallenges;
}
