package com.toeic.recommender.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@ConditionalOnProperty(name = "toeic.recommender.data-source", havingValue = "http", matchIfMissing = true)
@Slf4j
public class BackendClientConfig {

    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, RecommenderProperties properties) {
        RecommenderProperties.Backend backend = properties.backend();
        if (backend.apiKey() == null || backend.apiKey().isBlank()) {
            log.warn("toeic.recommender.backend.api-key is not set; internal API calls will be rejected");
        }
        log.info("Backend API base URL: {}, api key configured: {}", backend.baseUrl(),
                backend.apiKey() != null && !backend.apiKey().isBlank() ? "yes" : "no");
        return builder
                .setConnectTimeout(backend.connectTimeout())
                .setReadTimeout(backend.readTimeout())
                .build();
    }
}
