package com.example.traffic_optimizer.repository;

import com.example.traffic_optimizer.config.TrafficEngineProperties;
import com.example.traffic_optimizer.exception.RegionDataException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 현재 지역 데이터 스냅샷 보관소.
 * 요청은 {@link #current()}를 한 번 읽어 끝까지 같은 스냅샷을 사용하고, 갱신은 스냅샷 전체를 교체한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegionProfileRegistry {

    private final RegionDataLoader regionDataLoader;
    private final TrafficEngineProperties properties;

    private final AtomicReference<RegionProfileStore> current = new AtomicReference<>(RegionProfileStore.empty());

    @PostConstruct
    public void initialize() {
        current.set(regionDataLoader.load(properties.getDataLocation()));
    }

    public RegionProfileStore current() {
        return current.get();
    }

    /**
     *  데이터 재적재. 실패 시 기존 스냅샷 유지
     */
    public RegionProfileStore reload() {
        try {
            RegionProfileStore reloaded = regionDataLoader.load(properties.getDataLocation());
            RegionProfileStore previous = current.getAndSet(reloaded);
            log.info("Region data swapped: {} -> {}", previous.getVersion(), reloaded.getVersion());
            return reloaded;
        } catch (RegionDataException e) {
            log.error("Region data reload failed, keeping version {}", current.get().getVersion(), e);
            throw e;
        }
    }

    /**
     *  외부에서 만든 스냅샷으로 교체
     */
    public void replace(RegionProfileStore store) {
        if (store == null) {
            throw new RegionDataException("Cannot replace region data with null");
        }
        current.set(store);
        log.info("Region data replaced with version {}", store.getVersion());
    }
}
