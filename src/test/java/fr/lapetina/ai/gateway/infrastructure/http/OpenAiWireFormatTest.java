package fr.lapetina.ai.gateway.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ChatMessage;
import fr.lapetina.ai.gateway.domain.model.ReasoningStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiWireFormatTest {

    private final OpenAiWireFormat wireFormat = new OpenAiWireFormat();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should write messages, sampling parameters and stream flag")
    void shouldWriteRequestBody() throws JsonProcessingException {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(ChatMessage.system("Be brief"), ChatMessage.user("Hello")))
                .temperature(0.7)
                .maxTokens(100)
                .build();

        JsonNode body = objectMapper.readTree(wireFormat.requestBody(request, "gpt-4o", true));

        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("Hello");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.path("max_tokens").asInt()).isEqualTo(100);
        assertThat(body.path("stream").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("should omit unset sampling parameters")
    void shouldOmitUnsetParameters() throws JsonProcessingException {
        JsonNode body = objectMapper.readTree(
                wireFormat.requestBody(ChatCompletionRequest.ofPrompt("gpt-4o", "Hi"), "chat-deployment", false));

        assertThat(body.path("model").asText()).isEqualTo("chat-deployment");
        assertThat(body.has("temperature")).isFalse();
        assertThat(body.has("max_tokens")).isFalse();
        assertThat(body.path("stream").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("should write a one-token probe body")
    void shouldWriteProbeBody() throws JsonProcessingException {
        JsonNode body = objectMapper.readTree(wireFormat.probeBody("chat-deployment"));

        assertThat(body.path("max_tokens").asInt()).isEqualTo(1);
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("test");
    }

    @Test
    @DisplayName("should parse a complete response")
    void shouldParseResponse() throws JsonProcessingException {
        String json = """
                {
                  "id": "chatcmpl-123",
                  "object": "chat.completion",
                  "created": 1700000000,
                  "model": "gpt-4o-2024-05-13",
                  "choices": [{
                    "index": 0,
                    "message": {"role": "assistant", "content": "Hello there"},
                    "finish_reason": "length"
                  }],
                  "usage": {"prompt_tokens": 9, "completion_tokens": 3, "total_tokens": 12},
                  "system_fingerprint": "ignored"
                }
                """;

        ChatCompletionResponse response = wireFormat.parseResponse(json, "gpt-4o", "chatcmpl");

        assertThat(response.id()).isEqualTo("chatcmpl-123");
        assertThat(response.created()).isEqualTo(1700000000L);
        assertThat(response.model()).isEqualTo("gpt-4o-2024-05-13");
        assertThat(response.firstContent()).isEqualTo("Hello there");
        assertThat(response.choices().get(0).finishReason()).isEqualTo("length");
        assertThat(response.choices().get(0).message().role()).isEqualTo(ChatMessage.Role.ASSISTANT);
        assertThat(response.usage().totalTokens()).isEqualTo(12);
        assertThat(response.usage().promptTokens()).isEqualTo(9);
        assertThat(response.usage().completionTokens()).isEqualTo(3);
    }

    @Test
    @DisplayName("should fill missing response fields with fallbacks")
    void shouldApplyResponseFallbacks() throws JsonProcessingException {
        String json = """
                {"choices": [{"message": {"content": "Hi"}}]}
                """;

        ChatCompletionResponse response = wireFormat.parseResponse(json, "chat-deployment", "azure");

        assertThat(response.id()).startsWith("azure-");
        assertThat(response.object()).isEqualTo("chat.completion");
        assertThat(response.created()).isPositive();
        assertThat(response.model()).isEqualTo("chat-deployment");
        assertThat(response.choices().get(0).finishReason()).isEqualTo("stop");
        assertThat(response.usage()).isNull();
    }

    @Test
    @DisplayName("should parse a streaming chunk")
    void shouldParseChunk() throws JsonProcessingException {
        String json = """
                {"id":"c1","created":1,"model":"gpt-4o","choices":[{"index":0,"delta":{"role":"assistant","content":"Hel"}}]}
                """;

        ChatCompletionChunk chunk = wireFormat.parseChunk(json, "fallback", "chatcmpl");

        assertThat(chunk.id()).isEqualTo("c1");
        assertThat(chunk.object()).isEqualTo("chat.completion.chunk");
        assertThat(chunk.deltaContent()).isEqualTo("Hel");
        assertThat(chunk.choices().get(0).delta().role()).isEqualTo(ChatMessage.Role.ASSISTANT);
        assertThat(chunk.choices().get(0).finishReason()).isNull();
    }

    @Test
    @DisplayName("should extract payloads of SSE data lines only")
    void shouldExtractSsePayload() {
        assertThat(OpenAiWireFormat.ssePayload("data: {\"a\":1}")).isEqualTo("{\"a\":1}");
        assertThat(OpenAiWireFormat.ssePayload("data:[DONE]")).isEqualTo("[DONE]");
        assertThat(OpenAiWireFormat.ssePayload(": keep-alive")).isNull();
        assertThat(OpenAiWireFormat.ssePayload("")).isNull();
        assertThat(OpenAiWireFormat.ssePayload(null)).isNull();
    }

    @Test
    @DisplayName("should read the error message of an error body")
    void shouldReadErrorMessage() {
        assertThat(wireFormat.errorMessage("{\"error\":{\"message\":\"Invalid key\",\"type\":\"auth\"}}"))
                .isEqualTo("Invalid key");
        assertThat(wireFormat.errorMessage("{\"error\":\"Overloaded\"}")).isEqualTo("Overloaded");
        assertThat(wireFormat.errorMessage("<html>bad gateway</html>")).isNull();
        assertThat(wireFormat.errorMessage("")).isNull();
    }

    @Test
    @DisplayName("should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
        assertThatThrownBy(() -> wireFormat.parseResponse("{not json", "gpt-4o", "chatcmpl"))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    @DisplayName("should split step markers into reasoning steps")
    void shouldExtractReasoningSteps() {
        List<ReasoningStep> steps = OpenAiWireFormat.extractReasoningSteps(
                "Step 1: Read the question. Step 2: Compute 2+2.\nStep 3: Answer 4");

        assertThat(steps).extracting(ReasoningStep::step).containsExactly(1, 2, 3);
        assertThat(steps).extracting(ReasoningStep::thought)
                .containsExactly("Read the question.", "Compute 2+2.", "Answer 4");
        assertThat(steps).allSatisfy(step -> assertThat(step.confidence()).isEqualTo(85));
    }

    @Test
    @DisplayName("should return no reasoning steps without markers")
    void shouldReturnNoStepsWithoutMarkers() {
        assertThat(OpenAiWireFormat.extractReasoningSteps("Just an answer")).isEmpty();
        assertThat(OpenAiWireFormat.extractReasoningSteps("")).isEmpty();
        assertThat(OpenAiWireFormat.extractReasoningSteps(null)).isEmpty();
    }
}
