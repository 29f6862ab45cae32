package com.motaz.triage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.triage.reasoning.ChatCompletionReasoningClient;
import com.motaz.triage.reasoning.ReasoningClient;
import com.motaz.triage.reasoning.ReasoningSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Slf4j
@Configuration
public class ReasoningClientConfig {

    @Bean
    ReasoningClient reasoningClient(RestClient.Builder restClientBuilder, ReasoningSettings reasoningSettings,
                                    ObjectMapper objectMapper, ResourceLoader resourceLoader) throws IOException {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) reasoningSettings.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) reasoningSettings.readTimeout().toMillis());

        RestClient.Builder builder = restClientBuilder
                .requestFactory(requestFactory)
                .baseUrl(reasoningSettings.baseUrl());
        if (!reasoningSettings.apiKey().isBlank()) {
            String value = HttpHeaders.AUTHORIZATION.equalsIgnoreCase(reasoningSettings.apiKeyHeader())
                    ? "Bearer " + reasoningSettings.apiKey()
                    : reasoningSettings.apiKey();
            builder.defaultHeader(reasoningSettings.apiKeyHeader(), value);
        } else {
            log.warn("anomaly.reasoning.api-key is not set, reasoning calls are sent without credentials");
        }

        String systemPrompt;
        try (InputStream in = resourceLoader.getResource(reasoningSettings.systemPromptLocation()).getInputStream()) {
            systemPrompt = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        log.info("Reasoning client targets {} with model {}", reasoningSettings.baseUrl(), reasoningSettings.model());
        return new ChatCompletionReasoningClient(builder.build(), reasoningSettings, objectMapper, systemPrompt);
    }
}
