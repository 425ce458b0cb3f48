package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.enumclass.RouteSource;
import com.example.traffic_optimizer.entity.enumclass.TransportMode;
import com.example.traffic_optimizer.exception.RoutingProviderException;
import com.example.traffic_optimizer.service.dto.RouteLeg;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RoutingClientTest {

    private MockRestServiceServer server;
    private RoutingClient routingClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://osrm.test");
        server = MockRestServiceServer.bindTo(builder).build();
        routingClient = new RoutingClient(builder.build());
    }

    @Test
    void route_parsesFirstRoute() {
        server.expect(requestTo(containsString("/route/v1/car/77.594600,12.971600;77.640000,12.910000")))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"code":"Ok","routes":[{"distance":15300.0,"duration":1620.0},{"distance":17000.0,"duration":1500.0}]}
                        """, MediaType.APPLICATION_JSON));

        RouteLeg leg = routingClient.route(12.9716, 77.5946, 12.91, 77.64, TransportMode.DRIVING);

        assertThat(leg.getDistanceKm()).isEqualTo(15.3);
        assertThat(leg.getDurationMinutes()).isEqualTo(27.0);
        assertThat(leg.getSource()).isEqualTo(RouteSource.ROUTING_PROVIDER);
        server.verify();
    }

    @Test
    void route_usesFootProfileForWalking() {
        server.expect(requestTo(containsString("/route/v1/foot/")))
                .andRespond(withSuccess("{\"code\":\"Ok\",\"routes\":[{\"distance\":1000,\"duration\":720}]}",
                        MediaType.APPLICATION_JSON));

        routingClient.route(12.9716, 77.5946, 12.98, 77.60, TransportMode.WALKING);

        server.verify();
    }

    @Test
    void route_serverError_throwsProviderException() {
        server.expect(requestTo(containsString("/route/v1/bike/")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> routingClient.route(12.9716, 77.5946, 12.91, 77.64, TransportMode.CYCLING))
                .isInstanceOf(RoutingProviderException.class);
    }

    @Test
    void route_noRoute_throwsProviderException() {
        server.expect(requestTo(containsString("/route/v1/car/")))
                .andRespond(withSuccess("{\"code\":\"NoRoute\",\"routes\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> routingClient.route(12.9716, 77.5946, 0, 0, TransportMode.BUS))
                .isInstanceOf(RoutingProviderException.class)
                .hasMessageContaining("NoRoute");
    }
}
