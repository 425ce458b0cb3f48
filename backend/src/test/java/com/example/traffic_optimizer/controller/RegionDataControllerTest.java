package com.example.traffic_optimizer.controller;

import com.example.traffic_optimizer.exception.CityNotFoundException;
import com.example.traffic_optimizer.exception.RegionDataException;
import com.example.traffic_optimizer.service.RegionDataService;
import com.example.traffic_optimizer.service.dto.CityProfileResponse;
import com.example.traffic_optimizer.service.dto.RegionDataStatsResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RegionDataController.class)
class RegionDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegionDataService regionDataService;

    @Test
    void getCity_found() throws Exception {
        when(regionDataService.getCity("pune")).thenReturn(CityProfileResponse.builder()
                .name("Pune")
                .state("Maharashtra")
                .morningPeakStart(8)
                .morningPeakEnd(10)
                .build());

        mockMvc.perform(get("/api/v1/region/cities/pune"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Pune"))
                .andExpect(jsonPath("$.data.morningPeakEnd").value(10));
    }

    @Test
    void getCity_unknown_notFound() throws Exception {
        when(regionDataService.getCity("Atlantis")).thenThrow(new CityNotFoundException("Atlantis"));

        mockMvc.perform(get("/api/v1/region/cities/Atlantis"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("City profile not found. city=Atlantis"));
    }

    @Test
    void getFestivals_requiresMonth() throws Exception {
        mockMvc.perform(get("/api/v1/region/festivals"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getStats() throws Exception {
        when(regionDataService.getStats()).thenReturn(RegionDataStatsResponse.builder()
                .version("2025.1")
                .totalCities(8)
                .metroProjects(5)
                .build());

        mockMvc.perform(get("/api/v1/region/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").value("2025.1"))
                .andExpect(jsonPath("$.data.totalCities").value(8));
    }

    @Test
    void reload_failure_serverError() throws Exception {
        when(regionDataService.reload()).thenThrow(new RegionDataException("Region data not found. location=x"));

        mockMvc.perform(post("/api/v1/region/reload"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void getCities_lists() throws Exception {
        when(regionDataService.getCities()).thenReturn(List.of(
                CityProfileResponse.builder().name("Mumbai").build(),
                CityProfileResponse.builder().name("Delhi").build()));

        mockMvc.perform(get("/api/v1/region/cities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2));
    }
}
