package com.example.traffic_optimizer.entity;

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
public class WeatherImpact {

    private String condition;

    private String region;

    private int speedReduction;

    private double accidentRiskMultiplier;

    private String visibilityImpact;

    private List<String> recommendations;
}
