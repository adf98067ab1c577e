package fr.lapetina.ai.gateway.domain.model;

import java.util.List;

/**
 * One incremental piece of a streaming chat completion.
 */
public record ChatCompletionChunk(
        String id,
        String object,
        long created,
        String model,
        List<ChunkChoice> choices
) {
    public ChatCompletionChunk {
        choices = choices != null ? List.copyOf(choices) : List.of();
    }

    /**
     * Concatenated delta content of all choices in this chunk.
     */
    public String deltaContent() {
        StringBuilder sb = new StringBuilder();
        for (ChunkChoice choice : choices) {
            if (choice.delta() != null && choice.delta().content() != null) {
                sb.append(choice.delta().content());
            }
        }
        return sb.toString();
    }

    public record ChunkChoice(int index, Delta delta, String finishReason) {
    }

    /**
     * Partial message; the role is only sent with the first delta.
     */
    public record Delta(ChatMessage.Role role, String content) {
    }
}
