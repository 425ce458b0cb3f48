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
public class FestivalPattern {

    private String name;

    private List<String> regions;

    private List<Integer> months;

    private double trafficMultiplier;

    private String peakDays;

    private List<String> affectedRoutes;

    private List<String> recommendations;

    /**
     *  해당 월 또는 다음 달(12월 → 1월)에 열리는 축제인지
     */
    public boolean isUpcoming(int month) {
        int nextMonth = (month % 12) + 1;
        return months != null && (months.contains(month) || months.contains(nextMonth));
    }
}
