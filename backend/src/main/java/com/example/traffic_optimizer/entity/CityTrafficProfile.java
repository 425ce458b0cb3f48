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
public class CityTrafficProfile {

    private String name;

    private String state;

    private double lat;

    private double lng;

    private long population;

    private PeakHours peakHours;

    private AverageSpeed averageSpeed;

    private List<String> trafficHotspots;

    private List<String> majorRoads;

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @Builder
    public static class PeakHours {
        private PeakWindow morning;
        private PeakWindow evening;
    }

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @Builder
    public static class PeakWindow {
        private int start;
        private int end;
        private int severity;

        /**
         *  [start, end] 폐구간 포함 여부
         */
        public boolean contains(int hour) {
            return hour >= start && hour <= end;
        }

        public double factor() {
            return 1 + severity / 10.0;
        }
    }

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @Builder
    public static class AverageSpeed {
        private double peak;
        private double offPeak;
        private double night;
    }
}
