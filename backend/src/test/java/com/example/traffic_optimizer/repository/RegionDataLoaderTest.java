package com.example.traffic_optimizer.repository;

import com.example.traffic_optimizer.config.TrafficEngineProperties;
import com.example.traffic_optimizer.entity.CityTrafficProfile;
import com.example.traffic_optimizer.exception.RegionDataException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RegionDataLoaderTest {

    private final RegionDataLoader loader =
            new RegionDataLoader(new DefaultResourceLoader(), new ObjectMapper().findAndRegisterModules());

    @Test
    void load_bundledDataSet() {
        RegionProfileStore store = loader.load("classpath:region/india-traffic-data.json");

        assertThat(store.getVersion()).isEqualTo("2025.1");
        assertThat(store.getCities()).hasSize(8);

        CityTrafficProfile bengaluru = store.getCityProfile("bengaluru").orElseThrow();
        assertThat(bengaluru.getPeakHours().getMorning().getStart()).isEqualTo(8);
        assertThat(bengaluru.getPeakHours().getMorning().getEnd()).isEqualTo(11);
        assertThat(bengaluru.getPeakHours().getMorning().getSeverity()).isEqualTo(9);

        assertThat(store.getFestivals()).isNotEmpty();
        assertThat(store.getActiveConstructionZones("Bengaluru")).hasSize(2);
        assertThat(store.getActiveConstructionZones("Hyderabad")).isEmpty();
    }

    @Test
    void load_missingResource_throws() {
        assertThatThrownBy(() -> loader.load("classpath:region/missing.json"))
                .isInstanceOf(RegionDataException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_malformedDocument_throws() {
        assertThatThrownBy(() -> loader.load("classpath:region/malformed.json"))
                .isInstanceOf(RegionDataException.class);
    }

    @Test
    void registry_reloadFailure_keepsPreviousSnapshot() {
        RegionDataLoader failingLoader = mock(RegionDataLoader.class);
        TrafficEngineProperties properties = new TrafficEngineProperties();
        RegionProfileStore original = RegionFixtures.storeOf(RegionFixtures.testCity());
        when(failingLoader.load(properties.getDataLocation()))
                .thenReturn(original)
                .thenThrow(new RegionDataException("broken"));

        RegionProfileRegistry registry = new RegionProfileRegistry(failingLoader, properties);
        registry.initialize();

        assertThatThrownBy(registry::reload).isInstanceOf(RegionDataException.class);
        assertThat(registry.current()).isSameAs(original);
    }

    @Test
    void registry_reloadSuccess_swapsSnapshot() {
        RegionDataLoader stubLoader = mock(RegionDataLoader.class);
        TrafficEngineProperties properties = new TrafficEngineProperties();
        RegionProfileStore first = RegionFixtures.storeOf(RegionFixtures.testCity());
        RegionProfileStore second = RegionProfileStore.empty();
        when(stubLoader.load(properties.getDataLocation())).thenReturn(first, second);

        RegionProfileRegistry registry = new RegionProfileRegistry(stubLoader, properties);
        registry.initialize();
        RegionProfileStore held = registry.current();
        registry.reload();

        assertThat(held).isSameAs(first);
        assertThat(held.getCityProfile("Testpur")).isPresent();
        assertThat(registry.current()).isSameAs(second);
    }
}
