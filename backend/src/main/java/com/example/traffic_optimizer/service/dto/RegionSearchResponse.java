package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.BusRoute;
import com.example.traffic_optimizer.entity.DevelopmentZone;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionSearchResponse {

    private String query;
    private List<CityProfileResponse> cities;
    private List<InfrastructureUpdate> infrastructure;
    private List<BusRoute> busRoutes;
    private List<DevelopmentZone> developments;
}
