package com.example.traffic_optimizer.entity;

import com.example.traffic_optimizer.entity.enumclass.InfrastructureType;
import com.example.traffic_optimizer.entity.enumclass.TrafficImpact;
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
public class InfrastructureUpdate {

    private String id;

    private String city;

    private InfrastructureType type;

    private String name;

    private String description;

    private LocalDate completionDate;

    private List<String> impactAreas;

    private TrafficImpact trafficImpact;

    private Double lengthKm;

    private Double costCrores;
}
