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
public class HistoricalTrafficRecord {

    private int year;

    private int month;

    private String city;

    private long avgDailyVehicles;

    private double avgSpeedKmh;

    private int accidentCount;

    private int congestionIndex;

    private int airQualityIndex;

    private List<String> majorEvents;
}
