package fr.lapetina.ai.gateway.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * A chat completion request addressed to a provider.
 * Immutable and thread-safe.
 *
 * Shape constraints (non-empty messages, temperature range, ...) are not enforced here
 * but by {@code ChatRequestValidator}, so that violations surface as classified errors.
 *
 * @param temperature sampling temperature, or null for the backend default
 * @param maxTokens   completion token limit, or null for the backend default
 */
public record ChatCompletionRequest(
        String requestId,
        List<ChatMessage> messages,
        String model,
        Double temperature,
        Integer maxTokens,
        boolean stream,
        boolean reasoningMode
) {
    public ChatCompletionRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    /**
     * Creates a request with default sampling parameters.
     */
    public static ChatCompletionRequest of(String model, List<ChatMessage> messages) {
        return new ChatCompletionRequest(null, messages, model, null, null, false, false);
    }

    /**
     * Creates a single-turn user request.
     */
    public static ChatCompletionRequest ofPrompt(String model, String prompt) {
        return of(model, List.of(ChatMessage.user(prompt)));
    }

    /**
     * Returns a copy of this request with a different model.
     */
    public ChatCompletionRequest withModel(String newModel) {
        return new ChatCompletionRequest(requestId, messages, newModel, temperature, maxTokens, stream, reasoningMode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private List<ChatMessage> messages;
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private boolean stream;
        private boolean reasoningMode;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages = messages;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder reasoningMode(boolean reasoningMode) {
            this.reasoningMode = reasoningMode;
            return this;
        }

        public ChatCompletionRequest build() {
            return new ChatCompletionRequest(
                    requestId, messages, model, temperature, maxTokens, stream, reasoningMode
            );
        }
    }
}
