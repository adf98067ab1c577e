package fr.lapetina.ai.gateway.infrastructure.http;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig;
import fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Provider for the OpenAI API ({@code /v1/chat/completions}, bearer token authentication).
 */
public class OpenAiChatProvider extends OpenAiCompatibleProvider {

    public static final String NAME = ProviderConfig.OPENAI;
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    static final List<String> SUPPORTED_MODELS = List.of(
            // GPT-4o
            "gpt-4o",
            "gpt-4o-mini",
            "gpt-4o-2024-11-20",
            "gpt-4o-2024-08-06",
            "gpt-4o-2024-05-13",
            "gpt-4o-mini-2024-07-18",
            // GPT-4 Turbo
            "gpt-4-turbo",
            "gpt-4-turbo-2024-04-09",
            "gpt-4-turbo-preview",
            "gpt-4-0125-preview",
            "gpt-4-1106-preview",
            // GPT-4
            "gpt-4",
            "gpt-4-0613",
            "gpt-4-32k",
            "gpt-4-32k-0613",
            // GPT-3.5 Turbo
            "gpt-3.5-turbo",
            "gpt-3.5-turbo-0125",
            "gpt-3.5-turbo-1106",
            "gpt-3.5-turbo-16k",
            // Reasoning (o1 series)
            "o1",
            "o1-preview",
            "o1-mini",
            "o1-2024-12-17",
            "o1-preview-2024-09-12",
            "o1-mini-2024-09-12"
    );

    private static final List<String> REASONING_MODELS = List.of(
            "o1", "o1-preview", "o1-mini", "o1-2024-12-17", "o1-preview-2024-09-12", "o1-mini-2024-09-12"
    );

    private final ProviderConfig.OpenAiSettings settings;
    private final String baseUrl;

    public OpenAiChatProvider(ProviderConfig config, HttpClient httpClient, ProviderResilience resilience) {
        super(httpClient, resilience, config.getTimeout());
        this.settings = config.getOpenai();
        if (settings == null || settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new GatewayException(ErrorKind.CONFIGURATION_MISSING,
                    "OpenAI API key is required when using OpenAI provider", NAME, null);
        }
        this.baseUrl = normalizeBaseUrl(settings.getBaseUrl());
    }

    /**
     * Accepts base URLs with or without the {@code /v1} suffix.
     */
    static String normalizeBaseUrl(String configured) {
        if (configured == null || configured.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String url = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
        return url.endsWith("/v1") ? url : url + "/v1";
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> supportedModels() {
        return SUPPORTED_MODELS;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean supportsReasoning() {
        return true;
    }

    @Override
    protected String displayName() {
        return "OpenAI";
    }

    @Override
    protected String idPrefix() {
        return "chatcmpl";
    }

    @Override
    protected List<String> reasoningModels() {
        return REASONING_MODELS;
    }

    @Override
    protected String turboFamily() {
        return "gpt-3.5-turbo";
    }

    @Override
    protected URI completionsUri() {
        return resolve(baseUrl, "/chat/completions");
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder builder) {
        builder.header("Authorization", "Bearer " + settings.getApiKey());
        if (settings.getOrganization() != null && !settings.getOrganization().isBlank()) {
            builder.header("OpenAI-Organization", settings.getOrganization());
        }
        return builder;
    }

    /**
     * Lists the available models with the configured key.
     */
    @Override
    public CompletableFuture<Boolean> validateConfiguration() {
        HttpRequest request = authorize(HttpRequest.newBuilder())
                .uri(resolve(baseUrl, "/models"))
                .timeout(requestTimeout())
                .GET()
                .build();
        return probe(request);
    }

    @Override
    protected String statusMessage(int status, String detail) {
        return switch (status) {
            case 401 -> "[OpenAI] Invalid API key provided";
            case 403 -> "[OpenAI] Access denied. Please check your API key permissions";
            default -> super.statusMessage(status, detail);
        };
    }

    String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String toString() {
        return "OpenAiChatProvider{baseUrl='" + baseUrl + "'}";
    }
}
