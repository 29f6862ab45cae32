package com.motaz.triage.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.triage.model.AnomalousFeature;
import com.motaz.triage.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls an OpenAI compatible chat-completions endpoint and reads the triage
 * verdict from the JSON object the model returns.
 */
@Slf4j
public class ChatCompletionReasoningClient implements ReasoningClient {

    private static final String UNMAPPED_CATEGORY = "unmapped";

    private final RestClient restClient;
    private final ReasoningSettings reasoningSettings;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public ChatCompletionReasoningClient(RestClient restClient, ReasoningSettings reasoningSettings,
                                         ObjectMapper objectMapper, String systemPrompt) {
        this.restClient = restClient;
        this.reasoningSettings = reasoningSettings;
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public ReasoningVerdict analyze(AnomalyEvidence evidence) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", reasoningSettings.model());
        request.put("temperature", reasoningSettings.temperature());
        request.put("response_format", Map.of("type", "json_object"));
        request.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userMessage(evidence))));

        String body;
        try {
            body = restClient.post()
                    .uri(reasoningSettings.completionsPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new ReasoningException("Reasoning service call failed for anomaly " + evidence.getAnomalyId()
                    + ": " + e.getMessage(), e);
        }
        return parse(body, evidence.getAnomalyId());
    }

    ReasoningVerdict parse(String body, Long anomalyId) {
        if (body == null || body.isBlank()) {
            throw new ReasoningException("Reasoning service returned an empty body for anomaly " + anomalyId);
        }
        JsonNode completion = readJson(body, anomalyId);
        String content = completion.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ReasoningException("Reasoning service returned no message content for anomaly " + anomalyId);
        }
        JsonNode verdict = readJson(stripCodeFence(content), anomalyId);

        Severity severity;
        try {
            severity = Severity.parse(verdict.path("severity").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ReasoningException("Reasoning service returned an invalid severity for anomaly " + anomalyId, e);
        }
        JsonNode confidence = verdict.has("confidence_score") ? verdict.get("confidence_score") : verdict.path("confidence");
        return ReasoningVerdict.builder()
                .severity(severity)
                .category(category(verdict))
                .verdict(verdict.path("verdict").asText(null))
                .recommendation(recommendation(verdict))
                .notes(verdict.path("notes").asText(null))
                .confidence(confidence.isNumber() ? confidence.asDouble() : null)
                .keyIndicators(textList(verdict.path("key_indicators")))
                .modelName(completion.path("model").asText(reasoningSettings.model()))
                .build();
    }

    private String userMessage(AnomalyEvidence evidence) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("dataset_id", evidence.getDatasetId());
        event.put("dataset_name", evidence.getDatasetName());
        event.put("anomaly_id", evidence.getAnomalyId());
        event.put("session_id", evidence.getRunId());
        event.put("row_index", evidence.getRowIndex());
        event.put("anomaly_score", evidence.getAnomalyScore());
        event.put("priority", evidence.getPriority());
        List<Map<String, Object>> features = new ArrayList<>();
        if (evidence.getTopFeatures() != null) {
            for (AnomalousFeature feature : evidence.getTopFeatures()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", feature.getFeatureName());
                item.put("value", feature.getActualValue());
                item.put("z", feature.getEncodedValue());
                item.put("reconstruction_error", feature.getReconstructionError());
                features.add(item);
            }
        }
        event.put("top_features", features);
        event.put("row", evidence.getRawData());
        try {
            return "This event was flagged as anomalous by an upstream detector:\n\n"
                    + objectMapper.writeValueAsString(event)
                    + "\n\nReturn ONLY the JSON object as specified. No extra text.";
        } catch (JsonProcessingException e) {
            throw new ReasoningException("Could not serialize evidence for anomaly " + evidence.getAnomalyId(), e);
        }
    }

    private JsonNode readJson(String text, Long anomalyId) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ReasoningException("Reasoning service returned invalid JSON for anomaly " + anomalyId, e);
        }
    }

    private static String category(JsonNode verdict) {
        JsonNode mitre = verdict.path("mitre");
        if (mitre.isArray() && !mitre.isEmpty() && mitre.get(0).hasNonNull("id")) {
            return mitre.get(0).get("id").asText();
        }
        if (verdict.hasNonNull("category")) {
            return verdict.get("category").asText();
        }
        return UNMAPPED_CATEGORY;
    }

    private static String recommendation(JsonNode verdict) {
        List<String> actions = textList(verdict.path("triage").path("immediate_actions"));
        if (!actions.isEmpty()) {
            return String.join("; ", actions);
        }
        return verdict.path("recommendation").asText(null);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, closingFence).trim();
            }
        }
        return trimmed;
    }
}
