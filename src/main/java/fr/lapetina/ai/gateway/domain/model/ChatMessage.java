package fr.lapetina.ai.gateway.domain.model;

import java.util.List;

/**
 * A single message in a chat conversation.
 * Role and content may be null here; {@code ChatRequestValidator} rejects such messages.
 */
public record ChatMessage(
        Role role,
        String content,
        List<ReasoningStep> reasoning
) {
    public ChatMessage {
        reasoning = reasoning != null ? List.copyOf(reasoning) : List.of();
    }

    public ChatMessage(Role role, String content) {
        this(role, content, null);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }

    /**
     * Conversation roles, with their wire names.
     */
    public enum Role {
        SYSTEM("system"),
        USER("user"),
        ASSISTANT("assistant");

        private final String wireName;

        Role(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /**
         * Resolves a wire name, defaulting to ASSISTANT for roles this model does not know.
         */
        public static Role fromWireName(String name) {
            if (name == null) {
                return ASSISTANT;
            }
            for (Role role : values()) {
                if (role.wireName.equalsIgnoreCase(name)) {
                    return role;
                }
            }
            return ASSISTANT;
        }
    }
}
