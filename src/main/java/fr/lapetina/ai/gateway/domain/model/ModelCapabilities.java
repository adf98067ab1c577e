package fr.lapetina.ai.gateway.domain.model;

/**
 * Static capabilities of a model as reported by a provider.
 */
public record ModelCapabilities(int maxTokens, boolean supportsReasoning, boolean supportsStreaming) {

    public static final int DEFAULT_MAX_TOKENS = 4096;

    public static ModelCapabilities defaults(boolean supportsStreaming) {
        return new ModelCapabilities(DEFAULT_MAX_TOKENS, false, supportsStreaming);
    }
}
