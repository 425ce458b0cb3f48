package com.example.traffic_optimizer.repository;

import com.example.traffic_optimizer.entity.RegionDataSet;
import com.example.traffic_optimizer.exception.RegionDataException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Component
@RequiredArgsConstructor
public class RegionDataLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     *  JSON 문서 → 검증된 스냅샷
     */
    public RegionProfileStore load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RegionDataException("Region data not found. location=" + location);
        }

        try (InputStream in = resource.getInputStream()) {
            RegionDataSet dataSet = objectMapper.readValue(in, RegionDataSet.class);
            RegionProfileStore store = RegionProfileStore.of(dataSet);
            log.info("Loaded region data version {} from {}: {} cities, {} festivals, {} construction zones",
                    store.getVersion(), location, store.getCities().size(),
                    store.getFestivals().size(), store.getConstructionZones().size());
            return store;
        } catch (IOException e) {
            throw new RegionDataException("Failed to read region data. location=" + location, e);
        }
    }
}
