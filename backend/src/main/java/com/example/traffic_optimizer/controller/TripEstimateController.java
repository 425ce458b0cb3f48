package com.example.traffic_optimizer.controller;

import com.example.traffic_optimizer.controller.dto.DepartureSearchForm;
import com.example.traffic_optimizer.controller.dto.DurationForm;
import com.example.traffic_optimizer.controller.dto.TripEstimateForm;
import com.example.traffic_optimizer.service.TrafficMultiplierCalculator;
import com.example.traffic_optimizer.service.TransportModeCatalog;
import com.example.traffic_optimizer.service.TripEstimateService;
import com.example.traffic_optimizer.service.dto.AdjustedDuration;
import com.example.traffic_optimizer.service.dto.DepartureSearchResponse;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import com.example.traffic_optimizer.service.dto.TransportModeResponse;
import com.example.traffic_optimizer.service.dto.TripEstimateResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RequestMapping("/api/v1")
@RestController
public class TripEstimateController {

    private final TripEstimateService tripEstimateService;
    private final TrafficMultiplierCalculator trafficMultiplierCalculator;
    private final TransportModeCatalog transportModeCatalog;

    /**
     *  1. 여정 추정 (현재 출발 + 출발 시각 탐색 + 경로 정보)
     */
    @PostMapping("/trips/estimate")
    public ApiResponse<TripEstimateResponse> estimate(@Valid @RequestBody TripEstimateForm tripEstimateForm) {

        TripEstimateResponse response = tripEstimateService.estimate(tripEstimateForm);

        return ApiResponse.of(response);
    }

    /**
     *  2. 보정 소요시간
     */
    @PostMapping("/trips/duration")
    public ApiResponse<AdjustedDuration> computeDuration(@Valid @RequestBody DurationForm durationForm) {

        AdjustedDuration response = tripEstimateService.computeDuration(durationForm);

        return ApiResponse.of(response);
    }

    /**
     *  3. 혼잡 배수 (dayOfWeek: 0 = 일요일)
     */
    @GetMapping("/trips/multiplier")
    public ApiResponse<TrafficMultiplierResult> computeMultiplier(@RequestParam(name = "city") String city,
                                                                 @RequestParam(name = "hour") int hour,
                                                                 @RequestParam(name = "dayOfWeek") int dayOfWeek,
                                                                 @RequestParam(name = "month") int month) {

        TrafficMultiplierResult response = trafficMultiplierCalculator.computeMultiplier(city, hour, dayOfWeek, month);

        return ApiResponse.of(response);
    }

    /**
     *  4. 출발 시각 탐색
     */
    @PostMapping("/trips/departures")
    public ApiResponse<DepartureSearchResponse> searchDepartures(@Valid @RequestBody DepartureSearchForm departureSearchForm) {

        DepartureSearchResponse response = tripEstimateService.searchDepartures(departureSearchForm);

        return ApiResponse.of(response);
    }

    /**
     *  5. 이동수단 목록
     */
    @GetMapping("/transport-modes")
    public ApiResponse<List<TransportModeResponse>> getTransportModes() {

        List<TransportModeResponse> modes = transportModeCatalog.getAll().stream()
                .map(TransportModeResponse::from)
                .toList();

        return ApiResponse.of(modes);
    }
}
