package fr.lapetina.ai.gateway.domain.model;

import java.util.List;

/**
 * Complete (non-streaming) chat completion returned by a provider.
 * Immutable and thread-safe.
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        UsageInfo usage
) {
    public ChatCompletionResponse {
        choices = choices != null ? List.copyOf(choices) : List.of();
    }

    /**
     * Content of the first choice, or null if the backend returned none.
     */
    public String firstContent() {
        if (choices.isEmpty() || choices.get(0).message() == null) {
            return null;
        }
        return choices.get(0).message().content();
    }

    public record Choice(int index, ChatMessage message, String finishReason) {
    }
}
