package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.enumclass.OverallRating;
import com.example.traffic_optimizer.entity.enumclass.PeakHourStatus;
import com.example.traffic_optimizer.entity.enumclass.ReasoningSource;
import com.example.traffic_optimizer.entity.enumclass.RouteSource;
import com.example.traffic_optimizer.service.dto.AdjustedDuration;
import com.example.traffic_optimizer.service.dto.ReasoningAnnotation;
import com.example.traffic_optimizer.service.dto.RouteIntelligenceResponse;
import com.example.traffic_optimizer.service.dto.RouteLeg;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import com.example.traffic_optimizer.service.dto.TripEstimateResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TrafficReasoningServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private MockRestServiceServer server;
    private OpenAiClient openAiClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        openAiClient = new OpenAiClient(builder.build());
    }

    @Test
    void disabled_returnsRuleBasedWithoutCallingModel() {
        TrafficReasoningService service = new TrafficReasoningService(openAiClient, objectMapper, false);

        ReasoningAnnotation annotation = service.annotate(sampleEstimate());

        assertThat(annotation.getSource()).isEqualTo(ReasoningSource.RULE_BASED);
        assertThat(annotation.getConfidenceScore()).isEqualTo(70);
        assertThat(annotation.getSummary()).isEqualTo(
                "Route from Bengaluru to Bengaluru analyzed. Current traffic multiplier: 1.90x. Peak hour traffic active.");
        assertThat(annotation.getRecommendations()).containsExactly("Consider delaying travel by 1-2 hours");
        assertThat(annotation.getOptimalDepartureWindow()).isEqualTo("After 9:00 PM or before 7:00 AM");
        server.verify();
    }

    @Test
    void modelReplyInCodeFence_isParsed() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andRespond(withSuccess("""
                        {"choices":[{"finish_reason":"stop","message":{"role":"assistant",
                         "content":"```json\\n{\\"summary\\":\\"Heavy traffic\\",\\"recommendations\\":[\\"Leave at 11\\"],\\"optimalDepartureWindow\\":\\"After 11:00 AM\\"}\\n```"}}]}
                        """, MediaType.APPLICATION_JSON));
        TrafficReasoningService service = new TrafficReasoningService(openAiClient, objectMapper, true);

        ReasoningAnnotation annotation = service.annotate(sampleEstimate());

        assertThat(annotation.getSource()).isEqualTo(ReasoningSource.LANGUAGE_MODEL);
        assertThat(annotation.getConfidenceScore()).isEqualTo(85);
        assertThat(annotation.getSummary()).isEqualTo("Heavy traffic");
        assertThat(annotation.getRecommendations()).containsExactly("Leave at 11");
        assertThat(annotation.getOptimalDepartureWindow()).isEqualTo("After 11:00 AM");
        // 빠진 항목은 규칙 기반 값으로 채움
        assertThat(annotation.getHistoricalContext()).isEqualTo("Traffic improved by 4.0% compared to last year");
        server.verify();
    }

    @Test
    void modelFailure_fallsBackToRuleBased() {
        server.expect(requestTo("http://llm.test/v1/chat/completions")).andRespond(withServerError());
        TrafficReasoningService service = new TrafficReasoningService(openAiClient, objectMapper, true);

        ReasoningAnnotation annotation = service.annotate(sampleEstimate());

        assertThat(annotation.getSource()).isEqualTo(ReasoningSource.RULE_BASED);
        assertThat(annotation.getConfidenceScore()).isEqualTo(70);
    }

    @Test
    void unparsableReply_fallsBackToRuleBased() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"I think you should wait.\"}}]}",
                        MediaType.APPLICATION_JSON));
        TrafficReasoningService service = new TrafficReasoningService(openAiClient, objectMapper, true);

        assertThat(service.annotate(sampleEstimate()).getSource()).isEqualTo(ReasoningSource.RULE_BASED);
    }

    @Test
    void stripCodeFence_handlesPlainAndFencedContent() {
        assertThat(TrafficReasoningService.stripCodeFence("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(TrafficReasoningService.stripCodeFence("```\n{\"a\":1}```")).isEqualTo("{\"a\":1}");
        assertThat(TrafficReasoningService.stripCodeFence("  {\"a\":1} ")).isEqualTo("{\"a\":1}");
    }

    private static TripEstimateResponse sampleEstimate() {
        return TripEstimateResponse.builder()
                .originCity("Bengaluru")
                .destinationCity("Bengaluru")
                .mode("driving")
                .departureTime(LocalDateTime.of(2025, 3, 5, 9, 0))
                .baseRoute(RouteLeg.builder().distanceKm(20).durationMinutes(30).source(RouteSource.CALLER).build())
                .traffic(TrafficMultiplierResult.builder()
                        .multiplier(1.9)
                        .contributingFactors(List.of("Morning peak hour"))
                        .cityDataAvailable(true)
                        .build())
                .estimate(AdjustedDuration.builder().mode("driving").adjustedDurationMinutes(58).build())
                .intelligence(RouteIntelligenceResponse.builder()
                        .cityName("Bengaluru")
                        .peakHourStatus(PeakHourStatus.IN_PEAK)
                        .overallRating(OverallRating.POOR)
                        .congestionHotspots(List.of("Silk Board"))
                        .recommendations(List.of("Consider delaying travel by 1-2 hours"))
                        .historicalContext("Traffic improved by 4.0% compared to last year")
                        .activeConstructions(List.of())
                        .infrastructureSummary("No significant infrastructure changes affecting this route.")
                        .transitAdvice("No public transit data available for this route.")
                        .festivalAdvisories(List.of())
                        .weatherImpact("Normal weather conditions expected.")
                        .build())
                .build();
    }
}
