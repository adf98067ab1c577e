package fr.lapetina.ai.gateway.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig;
import fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Provider for an Azure OpenAI deployment.
 *
 * Calls {@code {endpoint}/openai/deployments/{deployment}/chat/completions?api-version=...}
 * with the {@code api-key} header. Azure names the GPT-3.5 family {@code gpt-35-turbo}.
 */
public class AzureOpenAiChatProvider extends OpenAiCompatibleProvider {

    private static final Logger log = LoggerFactory.getLogger(AzureOpenAiChatProvider.class);

    public static final String NAME = ProviderConfig.AZURE;

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
            "gpt-4-0125-preview",
            "gpt-4-1106-preview",
            // GPT-4
            "gpt-4",
            "gpt-4-0613",
            "gpt-4-32k",
            "gpt-4-32k-0613",
            // GPT-3.5 Turbo
            "gpt-35-turbo",
            "gpt-35-turbo-0125",
            "gpt-35-turbo-1106",
            "gpt-35-turbo-16k",
            // Reasoning
            "o1-preview",
            "o1-mini"
    );

    private static final List<String> REASONING_MODELS = List.of("o1-preview", "o1-mini");

    private final ProviderConfig.AzureSettings settings;
    private final URI completionsUri;

    public AzureOpenAiChatProvider(ProviderConfig config, HttpClient httpClient, ProviderResilience resilience) {
        super(httpClient, resilience, config.getTimeout());
        this.settings = config.getAzure();

        List<String> missing = missingSettings(settings);
        if (!missing.isEmpty()) {
            throw new GatewayException(ErrorKind.CONFIGURATION_MISSING,
                    "Azure configuration is incomplete, missing: " + String.join(", ", missing), NAME, null);
        }

        this.completionsUri = resolve(settings.getEndpoint(),
                "/openai/deployments/" + encode(settings.getDeployment())
                        + "/chat/completions?api-version=" + encode(settings.getApiVersion()));

        log.info("Azure OpenAI provider initialized: deployment={}, apiVersion={}",
                settings.getDeployment(), settings.getApiVersion());
    }

    private static List<String> missingSettings(ProviderConfig.AzureSettings settings) {
        List<String> missing = new ArrayList<>();
        if (settings == null || isBlank(settings.getApiKey())) {
            missing.add("apiKey");
        }
        if (settings == null || isBlank(settings.getEndpoint())) {
            missing.add("endpoint");
        }
        if (settings == null || isBlank(settings.getDeployment())) {
            missing.add("deployment");
        }
        if (settings == null || isBlank(settings.getApiVersion())) {
            missing.add("apiVersion");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
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
        return "Azure OpenAI";
    }

    @Override
    protected String idPrefix() {
        return "azure";
    }

    @Override
    protected List<String> reasoningModels() {
        return REASONING_MODELS;
    }

    @Override
    protected String turboFamily() {
        return "gpt-35-turbo";
    }

    @Override
    protected URI completionsUri() {
        return completionsUri;
    }

    @Override
    protected String fallbackModel(ChatCompletionRequest request) {
        return settings.getDeployment();
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder builder) {
        return builder.header("api-key", settings.getApiKey());
    }

    /**
     * Sends a one-token completion to the deployment.
     */
    @Override
    public CompletableFuture<Boolean> validateConfiguration() {
        String body;
        try {
            body = wireFormat().probeBody(settings.getDeployment());
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    createError(ErrorKind.INVALID_REQUEST, "[Azure OpenAI] Failed to encode request", null, e));
        }

        HttpRequest request = authorize(HttpRequest.newBuilder())
                .uri(completionsUri)
                .timeout(requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return probe(request);
    }

    @Override
    protected GatewayException statusError(int status, String detail) {
        if (status == 404) {
            return createError(ErrorKind.CONFIGURATION_MISSING, statusMessage(status, detail), status);
        }
        return super.statusError(status, detail);
    }

    @Override
    protected String statusMessage(int status, String detail) {
        return switch (status) {
            case 401 -> "[Azure OpenAI] Invalid API key or authentication failed";
            case 403 -> "[Azure OpenAI] Access denied. Please check your API key permissions and deployment access";
            case 404 -> "[Azure OpenAI] Deployment not found. Please check your deployment name";
            default -> super.statusMessage(status, detail);
        };
    }

    @Override
    public String toString() {
        return "AzureOpenAiChatProvider{deployment='" + settings.getDeployment() + "'}";
    }
}
