package fr.lapetina.ai.gateway.domain.model;

/**
 * Token usage, either for a single completion or accumulated by a provider.
 *
 * @param cost estimated cost, or null when the backend does not report one
 */
public record UsageInfo(long totalTokens, long promptTokens, long completionTokens, Double cost) {

    public static UsageInfo empty() {
        return new UsageInfo(0, 0, 0, null);
    }

    public static UsageInfo of(long promptTokens, long completionTokens) {
        return new UsageInfo(promptTokens + completionTokens, promptTokens, completionTokens, null);
    }
}
