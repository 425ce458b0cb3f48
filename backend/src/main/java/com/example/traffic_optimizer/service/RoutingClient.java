package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.dto.routing.OsrmRouteResponse;
import com.example.traffic_optimizer.entity.enumclass.RouteSource;
import com.example.traffic_optimizer.entity.enumclass.TransportMode;
import com.example.traffic_optimizer.exception.RoutingProviderException;
import com.example.traffic_optimizer.service.dto.RouteLeg;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Locale;

/**
 * 외부 경로 제공자 (OSRM 호환) 호출. 요청당 1회, 재시도 없음.
 */
@Slf4j
@Component
public class RoutingClient {

    private final RestClient restClient;

    public RoutingClient(@Qualifier("routingRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public RouteLeg route(double originLat, double originLng, double destLat, double destLng, TransportMode mode) {
        String uri = String.format(Locale.ROOT, "/route/v1/%s/%.6f,%.6f;%.6f,%.6f?overview=false",
                profileOf(mode), originLng, originLat, destLng, destLat);
        log.info("Calling routing provider: GET {}", uri);

        OsrmRouteResponse response;
        try {
            response = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(OsrmRouteResponse.class);
        } catch (RestClientException e) {
            throw new RoutingProviderException("Routing provider call failed: " + e.getMessage(), e);
        }

        if (response == null || !"Ok".equalsIgnoreCase(response.getCode())
                || response.getRoutes() == null || response.getRoutes().isEmpty()) {
            throw new RoutingProviderException("Routing provider returned no route. code="
                    + (response != null ? response.getCode() : null));
        }

        OsrmRouteResponse.Route route = response.getRoutes().get(0);
        return RouteLeg.builder()
                .distanceKm(route.getDistance() / 1000.0)
                .durationMinutes(route.getDuration() / 60.0)
                .source(RouteSource.ROUTING_PROVIDER)
                .build();
    }

    static String profileOf(TransportMode mode) {
        return switch (mode) {
            case CYCLING -> "bike";
            case WALKING -> "foot";
            default -> "car";
        };
    }
}
