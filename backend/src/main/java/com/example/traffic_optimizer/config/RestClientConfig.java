package com.example.traffic_optimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${openai.timeout-seconds:30}")
    private long openAiTimeoutSeconds;

    @Value("${routing.base-url:https://router.project-osrm.org}")
    private String routingBaseUrl;

    @Value("${routing.connect-timeout-millis:2000}")
    private long routingConnectTimeoutMillis;

    @Value("${routing.read-timeout-millis:5000}")
    private long routingReadTimeoutMillis;

    @Bean
    public RestClient openAiRestClient() {
        return RestClient.builder()
                .baseUrl(openAiBaseUrl)
                .requestFactory(requestFactory(Duration.ofSeconds(5), Duration.ofSeconds(openAiTimeoutSeconds)))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    /**
     *  경로 제공자 클라이언트 (재시도 없음, 타임아웃만 적용)
     */
    @Bean
    public RestClient routingRestClient() {
        return RestClient.builder()
                .baseUrl(routingBaseUrl)
                .requestFactory(requestFactory(
                        Duration.ofMillis(routingConnectTimeoutMillis),
                        Duration.ofMillis(routingReadTimeoutMillis)))
                .defaultHeader("Accept", "application/json")
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
