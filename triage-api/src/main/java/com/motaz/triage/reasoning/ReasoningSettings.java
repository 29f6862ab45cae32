package com.motaz.triage.reasoning;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ReasoningSettings {

    private final String baseUrl;
    private final String completionsPath;
    private final String apiKey;
    private final String apiKeyHeader;
    private final String model;
    private final double temperature;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final String systemPromptLocation;

    public ReasoningSettings(@Value("${anomaly.reasoning.base-url:http://localhost:8081/v1}") String baseUrl,
                             @Value("${anomaly.reasoning.completions-path:/chat/completions}") String completionsPath,
                             @Value("${anomaly.reasoning.api-key:}") String apiKey,
                             @Value("${anomaly.reasoning.api-key-header:Authorization}") String apiKeyHeader,
                             @Value("${anomaly.reasoning.model:gpt-4o-mini}") String model,
                             @Value("${anomaly.reasoning.temperature:0.2}") double temperature,
                             @Value("${anomaly.reasoning.connect-timeout:5s}") Duration connectTimeout,
                             @Value("${anomaly.reasoning.read-timeout:30s}") Duration readTimeout,
                             @Value("${anomaly.reasoning.system-prompt:classpath:prompts/triage-system-prompt.txt}") String systemPromptLocation) {
        this.baseUrl = baseUrl;
        this.completionsPath = completionsPath;
        this.apiKey = apiKey;
        this.apiKeyHeader = apiKeyHeader;
        this.model = model;
        this.temperature = temperature;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        this.systemPromptLocation = systemPromptLocation;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String completionsPath() {
        return completionsPath;
    }

    public String apiKey() {
        return apiKey;
    }

    public String apiKeyHeader() {
        return apiKeyHeader;
    }

    public String model() {
        return model;
    }

    public double temperature() {
        return temperature;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    public String systemPromptLocation() {
        return systemPromptLocation;
    }
}
