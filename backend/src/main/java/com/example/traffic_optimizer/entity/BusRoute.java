package com.example.traffic_optimizer.entity;

import com.example.traffic_optimizer.entity.enumclass.BusRouteType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class BusRoute {

    private String id;

    private String city;

    private String routeNumber;

    private String routeName;

    private String operator;

    private String startPoint;

    private String endPoint;

    private List<String> majorStops;

    private Frequency frequency;

    private OperatingHours operatingHours;

    private int avgTripDuration;

    private double distanceKm;

    private BusRouteType type;

    private LocalDate lastUpdated;

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @Builder
    public static class Frequency {
        private int peakMinutes;
        private int offPeakMinutes;
    }

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @Builder
    public static class OperatingHours {
        private String start;
        private String end;
    }
}
