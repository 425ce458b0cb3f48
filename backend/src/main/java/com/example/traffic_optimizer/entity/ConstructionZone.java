package com.example.traffic_optimizer.entity;

import com.example.traffic_optimizer.entity.enumclass.ConstructionStatus;
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
public class ConstructionZone {

    private String id;

    private String city;

    private String location;

    private String type;

    private LocalDate startDate;

    private LocalDate expectedEndDate;

    private ConstructionStatus status;

    private int delayMinutes;

    private List<String> alternateRoutes;

    private List<String> affectedDirections;

    public boolean isLive() {
        return status != null && status.isLive();
    }
}
