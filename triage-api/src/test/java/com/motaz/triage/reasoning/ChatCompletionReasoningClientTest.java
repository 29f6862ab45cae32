package com.motaz.triage.reasoning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.triage.model.AnomalousFeature;
import com.motaz.triage.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionReasoningClientTest {

    private static final String ENDPOINT = "http://llm.test/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private ChatCompletionReasoningClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        ReasoningSettings settings = new ReasoningSettings("http://llm.test/v1", "/chat/completions", "", "Authorization",
                "triage-model", 0.2, Duration.ofSeconds(1), Duration.ofSeconds(5), "");
        client = new ChatCompletionReasoningClient(builder.build(), settings, objectMapper, "You are a SOC analyst.");
    }

    @Test
    @DisplayName("Should send the evidence and read a MITRE mapped verdict")
    void shouldReadVerdict() throws Exception {
        String verdict = objectMapper.writeValueAsString(Map.of(
                "severity", "HIGH",
                "verdict", "suspicious",
                "mitre", List.of(Map.of("id", "T1078", "name", "Valid Accounts")),
                "triage", Map.of("immediate_actions", List.of("Lock the account", "Review sessions")),
                "confidence_score", 0.8,
                "key_indicators", List.of("amount far above baseline")));
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("triage-model"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andRespond(withSuccess(completion(verdict, "served-model"), MediaType.APPLICATION_JSON));

        ReasoningVerdict result = client.analyze(evidence());

        server.verify();
        assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(result.getCategory()).isEqualTo("T1078");
        assertThat(result.getVerdict()).isEqualTo("suspicious");
        assertThat(result.getRecommendation()).isEqualTo("Lock the account; Review sessions");
        assertThat(result.getConfidence()).isEqualTo(0.8);
        assertThat(result.getKeyIndicators()).containsExactly("amount far above baseline");
        assertThat(result.getModelName()).isEqualTo("served-model");
    }

    @Test
    @DisplayName("Should unwrap fenced content and fall back to an unmapped category")
    void shouldUnwrapCodeFence() throws Exception {
        String content = "```json\n{\"severity\": \"low\", \"recommendation\": \"monitor\"}\n```";

        ReasoningVerdict result = client.parse(completion(content, null), 7L);

        assertThat(result.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(result.getCategory()).isEqualTo("unmapped");
        assertThat(result.getRecommendation()).isEqualTo("monitor");
        assertThat(result.getConfidence()).isNull();
        assertThat(result.getModelName()).isEqualTo("triage-model");
    }

    @Test
    @DisplayName("Should raise ReasoningException when the service answers with an error status")
    void shouldFailOnServerError() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> client.analyze(evidence()))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("anomaly 11");
    }

    @Test
    @DisplayName("Should reject content that is not JSON")
    void shouldRejectNonJsonContent() throws Exception {
        String body = completion("I think this looks fine.", null);

        assertThatThrownBy(() -> client.parse(body, 11L))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    @DisplayName("Should reject a verdict with an unknown severity")
    void shouldRejectUnknownSeverity() throws Exception {
        String body = completion("{\"severity\": \"severe\"}", null);

        assertThatThrownBy(() -> client.parse(body, 11L))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("invalid severity");
    }

    @Test
    @DisplayName("Should reject a completion without choices")
    void shouldRejectMissingContent() {
        assertThatThrownBy(() -> client.parse("{\"choices\": []}", 11L))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("no message content");
    }

    // ---- Helpers

    private String completion(String content, String model) throws Exception {
        Map<String, Object> message = Map.of("role", "assistant", "content", content);
        Map<String, Object> body = model == null
                ? Map.of("choices", List.of(Map.of("message", message)))
                : Map.of("model", model, "choices", List.of(Map.of("message", message)));
        return objectMapper.writeValueAsString(body);
    }

    private static AnomalyEvidence evidence() {
        return AnomalyEvidence.builder()
                .datasetId(1L)
                .datasetName("transactions.csv")
                .anomalyId(11L)
                .runId("4")
                .rowIndex(2)
                .anomalyScore(3.5)
                .priority("critical")
                .topFeatures(List.of(AnomalousFeature.builder()
                        .featureName("amount")
                        .actualValue("9000")
                        .encodedValue(178.0)
                        .reconstructionError(31684.0)
                        .build()))
                .rawData(Map.of("amount", "9000"))
                .build();
    }
}
