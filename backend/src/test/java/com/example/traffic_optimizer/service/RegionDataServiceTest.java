package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.exception.CityNotFoundException;
import com.example.traffic_optimizer.repository.RegionDataLoader;
import com.example.traffic_optimizer.repository.RegionFixtures;
import com.example.traffic_optimizer.service.dto.CityProfileResponse;
import com.example.traffic_optimizer.service.dto.RegionDataStatsResponse;
import com.example.traffic_optimizer.service.dto.RegionSearchResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionDataServiceTest {

    private RegionDataService regionDataService;

    @BeforeEach
    void setUp() {
        RegionDataLoader loader =
                new RegionDataLoader(new DefaultResourceLoader(), new ObjectMapper().findAndRegisterModules());
        regionDataService = new RegionDataService(
                RegionFixtures.registryOf(loader.load("classpath:region/india-traffic-data.json")));
    }

    @Test
    void getCity_caseInsensitive() {
        CityProfileResponse pune = regionDataService.getCity("PUNE");

        assertThat(pune.getName()).isEqualTo("Pune");
        assertThat(pune.getState()).isEqualTo("Maharashtra");
    }

    @Test
    void getCity_unknown_throws() {
        assertThatThrownBy(() -> regionDataService.getCity("Atlantis"))
                .isInstanceOf(CityNotFoundException.class)
                .hasMessageContaining("Atlantis");
    }

    @Test
    void getStats_countsBundledData() {
        RegionDataStatsResponse stats = regionDataService.getStats();

        assertThat(stats.getVersion()).isEqualTo("2025.1");
        assertThat(stats.getTotalCities()).isEqualTo(8);
        assertThat(stats.getTotalInfrastructureProjects()).isEqualTo(16);
        assertThat(stats.getMetroProjects()).isEqualTo(7);
        assertThat(stats.getFlyovers()).isEqualTo(2);
        assertThat(stats.getExpressways()).isEqualTo(2);
        // 완료된 Hyderabad 구간 제외
        assertThat(stats.getActiveConstructionZones()).isEqualTo(5);
    }

    @Test
    void getUpcomingFestivals_wrapsIntoJanuary() {
        assertThat(regionDataService.getUpcomingFestivals(12))
                .extracting(FestivalPattern::getName)
                .containsExactlyInAnyOrder("Pongal/Sankranti", "Christmas/New Year");
    }

    @Test
    void getUpcomingFestivals_invalidMonth_throws() {
        assertThatThrownBy(() -> regionDataService.getUpcomingFestivals(13))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void search_matchesAcrossTables() {
        RegionSearchResponse result = regionDataService.search("Whitefield");

        assertThat(result.getCities()).isEmpty();
        assertThat(result.getInfrastructure()).hasSize(1);
        assertThat(result.getBusRoutes()).hasSize(1);

        assertThat(regionDataService.search("maharashtra").getCities())
                .extracting(CityProfileResponse::getName)
                .containsExactly("Mumbai", "Pune");
    }

    @Test
    void search_blank_throws() {
        assertThatThrownBy(() -> regionDataService.search("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
