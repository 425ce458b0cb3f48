package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.dto.openai.ReasoningReply;
import com.example.traffic_optimizer.entity.enumclass.PeakHourStatus;
import com.example.traffic_optimizer.entity.enumclass.ReasoningSource;
import com.example.traffic_optimizer.service.dto.DepartureRecommendation;
import com.example.traffic_optimizer.service.dto.ReasoningAnnotation;
import com.example.traffic_optimizer.service.dto.RouteIntelligenceResponse;
import com.example.traffic_optimizer.service.dto.TripEstimateResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 수치 결과에 덧붙이는 설명 (선택 기능).
 * 언어 모델 호출이 꺼져 있거나 실패하면 규칙 기반 설명으로 대체하며, 수치 결과는 건드리지 않는다.
 */
@Slf4j
@Service
public class TrafficReasoningService {

    static final int MODEL_CONFIDENCE = 85;
    static final int RULE_BASED_CONFIDENCE = 70;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final String SYSTEM_PROMPT = """
            You are an expert traffic analyst for India with access to several years of traffic data.
            Analyze the provided data and give actionable recommendations.

            Your response must be a valid JSON object with:
            {
              "summary": "2-3 sentence summary of current conditions",
              "recommendations": ["Array of 4-6 specific recommendations"],
              "optimalDepartureWindow": "e.g., 'Between 6:30-7:30 AM' or 'After 9:00 PM'",
              "alternativeRoutes": ["Array of 2-3 alternative route suggestions"],
              "historicalContext": "How current conditions compare to historical patterns"
            }

            Do not change the numbers you are given. Only return the JSON object.
            """;

    private final OpenAiClient openAiClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public TrafficReasoningService(OpenAiClient openAiClient, ObjectMapper objectMapper,
                                   @Value("${openai.enabled:false}") boolean enabled) {
        this.openAiClient = openAiClient;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    public ReasoningAnnotation annotate(TripEstimateResponse estimate) {
        ReasoningAnnotation fallback = ruleBased(estimate);
        if (!enabled) {
            return fallback;
        }

        try {
            String content = openAiClient.completeJson(SYSTEM_PROMPT, buildUserPrompt(estimate));
            if (content == null || content.isBlank()) {
                log.warn("Language model returned no content, using rule-based reasoning");
                return fallback;
            }

            ReasoningReply reply = objectMapper.readValue(stripCodeFence(content), ReasoningReply.class);
            return merge(reply, fallback);
        } catch (Exception e) {
            log.warn("Language model reasoning failed, using rule-based reasoning: {}", e.getMessage());
            return fallback;
        }
    }

    /**
     *  규칙 기반 설명
     */
    ReasoningAnnotation ruleBased(TripEstimateResponse estimate) {
        RouteIntelligenceResponse intelligence = estimate.getIntelligence();
        double multiplier = estimate.getTraffic().getMultiplier();
        boolean inPeak = intelligence != null && intelligence.getPeakHourStatus() == PeakHourStatus.IN_PEAK;

        String summary = String.format(Locale.ROOT, "Route from %s to %s analyzed. Current traffic multiplier: %.2fx. %s",
                estimate.getOriginCity(), estimate.getDestinationCity(), multiplier,
                inPeak ? "Peak hour traffic active." : "Off-peak conditions.");

        List<String> alternativeRoutes = intelligence == null ? List.of() : intelligence.getActiveConstructions().stream()
                .flatMap(zone -> zone.getAlternateRoutes() != null ? zone.getAlternateRoutes().stream() : Stream.empty())
                .distinct()
                .limit(3)
                .toList();

        return ReasoningAnnotation.builder()
                .source(ReasoningSource.RULE_BASED)
                .confidenceScore(RULE_BASED_CONFIDENCE)
                .summary(summary)
                .recommendations(intelligence != null ? intelligence.getRecommendations() : List.of())
                .optimalDepartureWindow(departureWindow(estimate, inPeak))
                .alternativeRoutes(alternativeRoutes)
                .historicalContext(intelligence != null ? intelligence.getHistoricalContext() : "No historical data available")
                .build();
    }

    private static String departureWindow(TripEstimateResponse estimate, boolean inPeak) {
        DepartureRecommendation recommendation = estimate.getDepartures() != null
                ? estimate.getDepartures().getRecommendation() : null;
        if (recommendation != null) {
            if (recommendation.isGoodToLeaveNow() || recommendation.isAnyTimeIsFine()) {
                return "Current time is suitable for travel";
            }
            if (recommendation.getNextOptimal() != null) {
                return "Around " + recommendation.getNextOptimal().getTimestamp().format(TIME_FORMAT)
                        + " (" + recommendation.getNextOptimal().getEstimatedDurationMinutes() + " min)";
            }
        }
        return inPeak ? "After 9:00 PM or before 7:00 AM" : "Current time is suitable for travel";
    }

    private static ReasoningAnnotation merge(ReasoningReply reply, ReasoningAnnotation fallback) {
        return ReasoningAnnotation.builder()
                .source(ReasoningSource.LANGUAGE_MODEL)
                .confidenceScore(MODEL_CONFIDENCE)
                .summary(hasText(reply.getSummary()) ? reply.getSummary() : fallback.getSummary())
                .recommendations(reply.getRecommendations() != null ? reply.getRecommendations() : fallback.getRecommendations())
                .optimalDepartureWindow(hasText(reply.getOptimalDepartureWindow())
                        ? reply.getOptimalDepartureWindow() : fallback.getOptimalDepartureWindow())
                .alternativeRoutes(reply.getAlternativeRoutes() != null ? reply.getAlternativeRoutes() : fallback.getAlternativeRoutes())
                .historicalContext(hasText(reply.getHistoricalContext())
                        ? reply.getHistoricalContext() : fallback.getHistoricalContext())
                .build();
    }

    private static String buildUserPrompt(TripEstimateResponse estimate) {
        RouteIntelligenceResponse intelligence = estimate.getIntelligence();
        StringBuilder sb = new StringBuilder();
        sb.append("ROUTE ANALYSIS REQUEST\n");
        sb.append("Cities: ").append(estimate.getOriginCity()).append(" -> ").append(estimate.getDestinationCity()).append('\n');
        sb.append(String.format(Locale.ROOT, "Distance: %.1f km%n", estimate.getBaseRoute().getDistanceKm()));
        sb.append("Transport Mode: ").append(estimate.getMode()).append('\n');
        sb.append("Departure Time: ").append(estimate.getDepartureTime()).append('\n');
        sb.append("Estimated Duration: ").append(estimate.getEstimate().getAdjustedDurationMinutes()).append(" min\n");
        sb.append(String.format(Locale.ROOT, "Traffic Multiplier: %.2fx%n", estimate.getTraffic().getMultiplier()));
        sb.append("Factors: ").append(String.join(", ", estimate.getTraffic().getContributingFactors())).append('\n');

        if (intelligence != null) {
            sb.append("Peak Hour Status: ").append(intelligence.getPeakHourStatus().getLabel()).append('\n');
            sb.append("Hot Spots: ").append(String.join(", ", intelligence.getCongestionHotspots())).append('\n');
            sb.append("Active Constructions: ").append(intelligence.getActiveConstructions().stream()
                    .map(zone -> zone.getLocation() + " (+" + zone.getDelayMinutes() + "min)")
                    .collect(Collectors.joining(", "))).append('\n');
            sb.append("Infrastructure: ").append(intelligence.getInfrastructureSummary()).append('\n');
            sb.append("Transit: ").append(intelligence.getTransitAdvice()).append('\n');
            sb.append("Festivals: ").append(String.join("; ", intelligence.getFestivalAdvisories())).append('\n');
            sb.append("Weather: ").append(intelligence.getWeatherImpact()).append('\n');
            sb.append("Historical Context: ").append(intelligence.getHistoricalContext()).append('\n');
        }

        if (estimate.getDepartures() != null && estimate.getDepartures().getRecommendation() != null
                && estimate.getDepartures().getRecommendation().getAbsoluteBest() != null) {
            sb.append("Best Departure In Horizon: ")
                    .append(estimate.getDepartures().getRecommendation().getAbsoluteBest().getTimestamp())
                    .append('\n');
        }
        sb.append("Provide comprehensive analysis and recommendations.");
        return sb.toString();
    }

    /**
     *  ```json ... ``` 감싼 응답 처리
     */
    static String stripCodeFence(String content) {
        String json = content.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
