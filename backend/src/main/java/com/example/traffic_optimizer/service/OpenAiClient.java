package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.dto.openai.OpenAiChatRequest;
import com.example.traffic_optimizer.dto.openai.OpenAiChatResponse;
import com.example.traffic_optimizer.dto.openai.OpenAiMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * 교통 설명 생성용 Chat Completions 클라이언트
 */
@Slf4j
@Component
public class OpenAiClient {

    private final RestClient restClient;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private Double temperature;

    @Value("${openai.max-tokens:600}")
    private Integer maxTokens;

    public OpenAiClient(@Qualifier("openAiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     *  JSON 객체 응답 요청. 본문이 없으면 null
     */
    public String completeJson(String systemPrompt, String userPrompt) {
        OpenAiChatRequest request = OpenAiChatRequest.builder()
                .model(model)
                .messages(List.of(OpenAiMessage.system(systemPrompt), OpenAiMessage.user(userPrompt)))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .responseFormat(OpenAiChatRequest.ResponseFormat.jsonObject())
                .build();

        long startedAt = System.currentTimeMillis();
        OpenAiChatResponse response = restClient.post()
                .uri("/chat/completions")
                .body(request)
                .retrieve()
                .body(OpenAiChatResponse.class);
        log.debug("Reasoning completion received in {} ms", System.currentTimeMillis() - startedAt);

        return response != null ? response.firstContent() : null;
    }
}
