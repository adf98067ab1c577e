package fr.lapetina.ai.gateway.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ChatMessage;
import fr.lapetina.ai.gateway.domain.model.ReasoningStep;
import fr.lapetina.ai.gateway.domain.model.UsageInfo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON mapping of the OpenAI-compatible chat completions protocol.
 *
 * Missing response fields are filled with fallbacks (generated id, current time,
 * the model that was asked for) so that partial answers from compatible backends
 * still map to complete responses.
 */
public final class OpenAiWireFormat {

    static final String SSE_DATA_PREFIX = "data:";
    static final String SSE_DONE = "[DONE]";

    static final int DEFAULT_REASONING_CONFIDENCE = 85;
    private static final Pattern STEP_PATTERN = Pattern.compile("Step (\\d{1,9}):");

    private final ObjectMapper objectMapper;

    public OpenAiWireFormat() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Builds the JSON body of a chat completions call.
     *
     * @param model model (or deployment) name sent to the backend
     */
    public String requestBody(ChatCompletionRequest request, String model, boolean stream) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                    .put("role", message.role().wireName())
                    .put("content", message.content());
        }

        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        body.put("stream", stream);

        return objectMapper.writeValueAsString(body);
    }

    /**
     * Body of a minimal one-token call, used to check credentials.
     */
    public String probeBody(String model) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.putArray("messages").addObject()
                .put("role", ChatMessage.Role.USER.wireName())
                .put("content", "test");
        body.put("max_tokens", 1);
        return objectMapper.writeValueAsString(body);
    }

    public ChatCompletionResponse parseResponse(String json, String fallbackModel, String idPrefix)
            throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);

        List<ChatCompletionResponse.Choice> choices = new ArrayList<>();
        JsonNode choicesNode = root.path("choices");
        for (int i = 0; i < choicesNode.size(); i++) {
            JsonNode choice = choicesNode.get(i);
            JsonNode message = choice.path("message");
            String content = message.path("content").asText("");
            choices.add(new ChatCompletionResponse.Choice(
                    choice.path("index").asInt(i),
                    new ChatMessage(
                            ChatMessage.Role.fromWireName(message.path("role").asText(null)),
                            content,
                            extractReasoningSteps(content)
                    ),
                    textOrDefault(choice.path("finish_reason"), "stop")
            ));
        }

        UsageInfo usage = null;
        JsonNode usageNode = root.path("usage");
        if (usageNode.isObject()) {
            long prompt = usageNode.path("prompt_tokens").asLong(0);
            long completion = usageNode.path("completion_tokens").asLong(0);
            usage = new UsageInfo(usageNode.path("total_tokens").asLong(prompt + completion), prompt, completion, null);
        }

        return new ChatCompletionResponse(
                textOrDefault(root.path("id"), idPrefix + "-" + System.currentTimeMillis()),
                textOrDefault(root.path("object"), "chat.completion"),
                root.path("created").asLong(Instant.now().getEpochSecond()),
                textOrDefault(root.path("model"), fallbackModel),
                choices,
                usage
        );
    }

    public ChatCompletionChunk parseChunk(String json, String fallbackModel, String idPrefix)
            throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);

        List<ChatCompletionChunk.ChunkChoice> choices = new ArrayList<>();
        JsonNode choicesNode = root.path("choices");
        for (int i = 0; i < choicesNode.size(); i++) {
            JsonNode choice = choicesNode.get(i);
            JsonNode delta = choice.path("delta");
            String role = delta.path("role").asText(null);
            choices.add(new ChatCompletionChunk.ChunkChoice(
                    choice.path("index").asInt(i),
                    new ChatCompletionChunk.Delta(
                            role != null ? ChatMessage.Role.fromWireName(role) : null,
                            delta.path("content").asText("")
                    ),
                    textOrDefault(choice.path("finish_reason"), null)
            ));
        }

        return new ChatCompletionChunk(
                textOrDefault(root.path("id"), idPrefix + "-chunk-" + System.currentTimeMillis()),
                textOrDefault(root.path("object"), "chat.completion.chunk"),
                root.path("created").asLong(Instant.now().getEpochSecond()),
                textOrDefault(root.path("model"), fallbackModel),
                choices
        );
    }

    /**
     * Returns the payload of an SSE {@code data:} line, or null for any other line.
     */
    static String ssePayload(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return null;
        }
        return line.substring(SSE_DATA_PREFIX.length()).trim();
    }

    /**
     * Extracts the {@code error.message} of an error body, or null when there is none.
     */
    public String errorMessage(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(json).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            return textOrDefault(error.path("message"), null);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Splits content on "Step N:" markers into reasoning steps.
     *
     * @return the steps in order, empty when the content has no markers
     */
    public static List<ReasoningStep> extractReasoningSteps(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        Matcher matcher = STEP_PATTERN.matcher(content);
        List<int[]> markers = new ArrayList<>();
        List<Integer> numbers = new ArrayList<>();
        while (matcher.find()) {
            markers.add(new int[]{matcher.start(), matcher.end()});
            numbers.add(Integer.parseInt(matcher.group(1)));
        }

        List<ReasoningStep> steps = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            int start = markers.get(i)[1];
            int end = i + 1 < markers.size() ? markers.get(i + 1)[0] : content.length();
            String thought = content.substring(start, end).trim();
            if (!thought.isEmpty()) {
                steps.add(new ReasoningStep(numbers.get(i), thought, DEFAULT_REASONING_CONFIDENCE));
            }
        }
        return steps;
    }

    private static String textOrDefault(JsonNode node, String defaultValue) {
        return node.isMissingNode() || node.isNull() ? defaultValue : node.asText();
    }
}
