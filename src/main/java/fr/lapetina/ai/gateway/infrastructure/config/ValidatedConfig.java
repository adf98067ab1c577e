package fr.lapetina.ai.gateway.infrastructure.config;

/**
 * Configuration values available once the environment passed validation.
 *
 * @param apiKey       credential of the selected provider mode
 * @param baseUrl      custom API base URL (OpenAI) or resource endpoint (Azure), may be null
 * @param model        model name
 * @param timeoutMs    request timeout in milliseconds
 * @param disableDebug whether debug output is disabled
 */
public record ValidatedConfig(
        String apiKey,
        String baseUrl,
        String model,
        long timeoutMs,
        boolean disableDebug
) {

    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
    public static final long DEFAULT_TIMEOUT_MS = 100_000;

    @Override
    public String toString() {
        // Never log the credential
        return "ValidatedConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", model='" + model + '\'' +
                ", timeoutMs=" + timeoutMs +
                ", disableDebug=" + disableDebug +
                '}';
    }
}
