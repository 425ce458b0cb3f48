package com.example.traffic_optimizer.controller;

import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import com.example.traffic_optimizer.service.RegionDataService;
import com.example.traffic_optimizer.service.dto.CityProfileResponse;
import com.example.traffic_optimizer.service.dto.RegionDataStatsResponse;
import com.example.traffic_optimizer.service.dto.RegionSearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
@RequestMapping("/api/v1/region")
@RestController
public class RegionDataController {

    private final RegionDataService regionDataService;

    /**
     *  1. 도시 목록
     */
    @GetMapping("/cities")
    public ApiResponse<List<CityProfileResponse>> getCities() {
        return ApiResponse.of(regionDataService.getCities());
    }

    /**
     *  2. 도시 단건
     */
    @GetMapping("/cities/{name}")
    public ApiResponse<CityProfileResponse> getCity(@PathVariable(name = "name") String name) {
        return ApiResponse.of(regionDataService.getCity(name));
    }

    /**
     *  3. 진행 중 공사 구간
     */
    @GetMapping("/constructions")
    public ApiResponse<List<ConstructionZone>> getConstructions(@RequestParam(name = "city", required = false) String city) {
        return ApiResponse.of(regionDataService.getActiveConstructionZones(city));
    }

    /**
     *  4. 이번 달/다음 달 축제
     */
    @GetMapping("/festivals")
    public ApiResponse<List<FestivalPattern>> getFestivals(@RequestParam(name = "month") int month) {
        return ApiResponse.of(regionDataService.getUpcomingFestivals(month));
    }

    /**
     *  5. 인프라 변경
     */
    @GetMapping("/infrastructure")
    public ApiResponse<List<InfrastructureUpdate>> getInfrastructure(
            @RequestParam(name = "city") String city,
            @RequestParam(name = "afterYear", required = false) Integer afterYear) {
        return ApiResponse.of(regionDataService.getInfrastructureUpdates(city, afterYear));
    }

    @GetMapping("/stats")
    public ApiResponse<RegionDataStatsResponse> getStats() {
        return ApiResponse.of(regionDataService.getStats());
    }

    @GetMapping("/search")
    public ApiResponse<RegionSearchResponse> search(@RequestParam(name = "query") String query) {
        return ApiResponse.of(regionDataService.search(query));
    }

    /**
     *  데이터 재적재 (실패 시 기존 데이터 유지)
     */
    @PostMapping("/reload")
    public ApiResponse<RegionDataStatsResponse> reload() {
        log.info("Region data reload requested");
        return ApiResponse.of(regionDataService.reload(), "Region data reloaded");
    }
}
