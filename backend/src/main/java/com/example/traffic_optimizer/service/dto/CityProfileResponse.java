package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.CityTrafficProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CityProfileResponse {

    private String name;
    private String state;
    private double lat;
    private double lng;
    private long population;

    private int morningPeakStart;
    private int morningPeakEnd;
    private int morningPeakSeverity;
    private int eveningPeakStart;
    private int eveningPeakEnd;
    private int eveningPeakSeverity;

    private double peakSpeedKmh;
    private double offPeakSpeedKmh;
    private double nightSpeedKmh;

    private List<String> trafficHotspots;
    private List<String> majorRoads;

    // Entity -> Dto
    public static CityProfileResponse from(CityTrafficProfile city) {
        CityTrafficProfile.PeakWindow morning = city.getPeakHours().getMorning();
        CityTrafficProfile.PeakWindow evening = city.getPeakHours().getEvening();
        return CityProfileResponse.builder()
                .name(city.getName())
                .state(city.getState())
                .lat(city.getLat())
                .lng(city.getLng())
                .population(city.getPopulation())
                .morningPeakStart(morning.getStart())
                .morningPeakEnd(morning.getEnd())
                .morningPeakSeverity(morning.getSeverity())
                .eveningPeakStart(evening.getStart())
                .eveningPeakEnd(evening.getEnd())
                .eveningPeakSeverity(evening.getSeverity())
                .peakSpeedKmh(city.getAverageSpeed().getPeak())
                .offPeakSpeedKmh(city.getAverageSpeed().getOffPeak())
                .nightSpeedKmh(city.getAverageSpeed().getNight())
                .trafficHotspots(city.getTrafficHotspots())
                .majorRoads(city.getMajorRoads())
                .build();
    }
}
