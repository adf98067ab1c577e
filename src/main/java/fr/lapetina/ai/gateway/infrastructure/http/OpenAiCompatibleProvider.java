package fr.lapetina.ai.gateway.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.domain.model.ModelCapabilities;
import fr.lapetina.ai.gateway.domain.model.UsageInfo;
import fr.lapetina.ai.gateway.domain.provider.AbstractChatProvider;
import fr.lapetina.ai.gateway.infrastructure.resilience.ErrorClassifier;
import fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base class for providers speaking the OpenAI chat completions protocol over HTTP.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every completion call goes through
 * the provider's {@link ProviderResilience} chain; streaming calls get fewer attempts since
 * only the opening of the stream can be retried.
 *
 * Subclasses supply endpoints, authentication and error texts.
 */
public abstract class OpenAiCompatibleProvider extends AbstractChatProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    static final int STREAMING_MAX_ATTEMPTS = 2;

    private final HttpClient httpClient;
    private final ProviderResilience resilience;
    private final RetryPolicy streamingPolicy;
    private final Duration requestTimeout;
    private final OpenAiWireFormat wireFormat = new OpenAiWireFormat();

    private final AtomicLong promptTokens = new AtomicLong();
    private final AtomicLong completionTokens = new AtomicLong();

    protected OpenAiCompatibleProvider(HttpClient httpClient, ProviderResilience resilience, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.resilience = Objects.requireNonNull(resilience, "resilience is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.streamingPolicy = resilience.getRetryPolicy().toBuilder()
                .maxAttempts(Math.min(STREAMING_MAX_ATTEMPTS, resilience.getRetryPolicy().getMaxAttempts()))
                .build();
    }

    /**
     * Prefix of error messages, e.g. "OpenAI".
     */
    protected abstract String displayName();

    protected abstract URI completionsUri();

    /**
     * Adds the credential headers to a request.
     */
    protected abstract HttpRequest.Builder authorize(HttpRequest.Builder builder);

    /**
     * Model name sent on the wire for a request.
     */
    protected String wireModel(ChatCompletionRequest request) {
        return request.model();
    }

    /**
     * Model name used when the backend's answer does not carry one.
     */
    protected String fallbackModel(ChatCompletionRequest request) {
        return request.model();
    }

    /**
     * Prefix of ids generated when the backend's answer does not carry one.
     */
    protected abstract String idPrefix();

    /**
     * Model names (or fragments) served as reasoning models.
     */
    protected abstract List<String> reasoningModels();

    /**
     * Name of the GPT-3.5 Turbo family on this backend.
     */
    protected abstract String turboFamily();

    @Override
    public CompletableFuture<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request) {
        try {
            validateRequest(request);
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }

        Instant start = Instant.now();
        log.debug("Chat completion request: provider={}, requestId={}, model={}, messages={}",
                name(), request.requestId(), request.model(), request.messages().size());

        return resilience.call(() -> send(request))
                .whenComplete((response, error) -> {
                    long latencyMs = Duration.between(start, Instant.now()).toMillis();
                    if (error == null) {
                        recordUsage(response.usage());
                        log.info("Chat completion succeeded: provider={}, requestId={}, model={}, latencyMs={}",
                                name(), request.requestId(), request.model(), latencyMs);
                    } else {
                        log.error("Chat completion failed: provider={}, requestId={}, model={}, latencyMs={}, error={}",
                                name(), request.requestId(), request.model(), latencyMs,
                                ErrorClassifier.unwrap(error).getMessage());
                    }
                });
    }

    private CompletableFuture<ChatCompletionResponse> send(ChatCompletionRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = completionRequest(request, false);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    createError(ErrorKind.INVALID_REQUEST, "[" + displayName() + "] Failed to encode request", null, e));
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw toGatewayException(error);
                    }
                    if (response.statusCode() >= 400) {
                        throw statusError(response.statusCode(), wireFormat.errorMessage(response.body()));
                    }
                    try {
                        return wireFormat.parseResponse(response.body(), fallbackModel(request), idPrefix());
                    } catch (JsonProcessingException e) {
                        throw createError(ErrorKind.EXTERNAL_API_FAILURE,
                                "[" + displayName() + "] Invalid response body", response.statusCode(), e);
                    }
                });
    }

    @Override
    public Stream<ChatCompletionChunk> createStreamingChatCompletion(ChatCompletionRequest request) {
        validateRequest(request);

        log.debug("Streaming chat completion request: provider={}, requestId={}, model={}",
                name(), request.requestId(), request.model());

        Stream<String> lines;
        try {
            lines = resilience.call(() -> openStream(request), streamingPolicy).join();
        } catch (CompletionException e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (cause instanceof GatewayException gatewayException) {
                throw gatewayException;
            }
            throw toGatewayException(cause);
        }

        String fallbackModel = fallbackModel(request);
        return lines
                .map(OpenAiWireFormat::ssePayload)
                .filter(Objects::nonNull)
                .takeWhile(payload -> !OpenAiWireFormat.SSE_DONE.equals(payload))
                .filter(payload -> !payload.isEmpty())
                .map(payload -> parseChunk(payload, fallbackModel));
    }

    private CompletableFuture<Stream<String>> openStream(ChatCompletionRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = completionRequest(request, true);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    createError(ErrorKind.INVALID_REQUEST, "[" + displayName() + "] Failed to encode request", null, e));
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines())
                .handle((response, error) -> {
                    if (error != null) {
                        throw toGatewayException(error);
                    }
                    if (response.statusCode() >= 400) {
                        String body;
                        try (Stream<String> errorLines = response.body()) {
                            body = errorLines.collect(Collectors.joining("\n"));
                        }
                        throw statusError(response.statusCode(), wireFormat.errorMessage(body));
                    }
                    return response.body();
                });
    }

    private ChatCompletionChunk parseChunk(String payload, String fallbackModel) {
        try {
            return wireFormat.parseChunk(payload, fallbackModel, idPrefix());
        } catch (JsonProcessingException e) {
            throw createError(ErrorKind.EXTERNAL_API_FAILURE, "[" + displayName() + "] Invalid stream chunk", null, e);
        }
    }

    private HttpRequest completionRequest(ChatCompletionRequest request, boolean stream) throws JsonProcessingException {
        String body = wireFormat.requestBody(request, wireModel(request), stream);
        return authorize(HttpRequest.newBuilder())
                .uri(completionsUri())
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    /**
     * Sends a credential check request.
     *
     * @return true when the backend answers 2xx, false on any other outcome
     */
    protected CompletableFuture<Boolean> probe(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean valid = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (valid) {
                        log.info("Configuration validated: provider={}, status={}", name(), response.statusCode());
                    } else {
                        log.warn("Configuration validation failed: provider={}, status={}", name(), response.statusCode());
                    }
                    return valid;
                })
                .exceptionally(ex -> {
                    log.warn("Configuration validation error: provider={}, error={}",
                            name(), ErrorClassifier.unwrap(ex).getMessage());
                    return false;
                });
    }

    protected OpenAiWireFormat wireFormat() {
        return wireFormat;
    }

    protected Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Maps an HTTP error status to a classified error.
     */
    protected GatewayException statusError(int status, String detail) {
        ErrorKind kind = switch (status) {
            case 401 -> ErrorKind.AUTHENTICATION_FAILURE;
            case 403 -> ErrorKind.AUTHORIZATION_FAILURE;
            case 429 -> ErrorKind.RATE_LIMITED;
            case 502 -> ErrorKind.NETWORK_FAILURE;
            case 504 -> ErrorKind.TIMEOUT;
            default -> ErrorKind.EXTERNAL_API_FAILURE;
        };
        return createError(kind, statusMessage(status, detail), status);
    }

    /**
     * User-facing message for an HTTP error status.
     */
    protected String statusMessage(int status, String detail) {
        String prefix = "[" + displayName() + "] ";
        return switch (status) {
            case 429 -> prefix + "Rate limit exceeded. Please try again later";
            case 500 -> prefix + "Internal server error. Please try again later";
            case 502 -> prefix + "Bad gateway. Please try again later";
            case 503 -> prefix + "Service unavailable. Please try again later";
            case 504 -> prefix + "Gateway timeout. Please try again later";
            default -> prefix + "HTTP " + status + ": " + (detail != null ? detail : "Unknown error");
        };
    }

    private GatewayException toGatewayException(Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        if (cause instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        ErrorKind kind = ErrorClassifier.classify(cause).orElse(ErrorKind.EXTERNAL_API_FAILURE);
        String message = switch (kind) {
            case TIMEOUT -> displayName() + " timeout: " + cause.getMessage();
            case NETWORK_FAILURE -> displayName() + " network error: " + cause.getMessage();
            default -> displayName() + " API Error: " + cause.getMessage();
        };
        return createError(kind, message, null, cause);
    }

    /**
     * Token limits by model family; reasoning models have streaming disabled.
     */
    @Override
    public ModelCapabilities getModelCapabilities(String model) {
        boolean reasoning = reasoningModels().stream().anyMatch(model::contains);

        int maxTokens = ModelCapabilities.DEFAULT_MAX_TOKENS;
        if (model.contains("gpt-4o")) {
            maxTokens = 128000;
        } else if (model.contains("gpt-4-turbo") || model.contains("gpt-4-0125") || model.contains("gpt-4-1106")) {
            maxTokens = 128000;
        } else if (model.contains("gpt-4-32k")) {
            maxTokens = 32768;
        } else if (model.contains("gpt-4")) {
            maxTokens = 8192;
        } else if (model.contains(turboFamily() + "-16k")) {
            maxTokens = 16384;
        } else if (model.contains(turboFamily())) {
            maxTokens = 4096;
        } else if (reasoning) {
            maxTokens = 128000;
        }

        return new ModelCapabilities(maxTokens, reasoning, !reasoning);
    }

    private void recordUsage(UsageInfo usage) {
        if (usage != null) {
            promptTokens.addAndGet(usage.promptTokens());
            completionTokens.addAndGet(usage.completionTokens());
        }
    }

    /**
     * Tokens reported by the backend across all completed calls of this instance.
     */
    @Override
    public CompletableFuture<UsageInfo> getUsageInfo() {
        return CompletableFuture.completedFuture(UsageInfo.of(promptTokens.get(), completionTokens.get()));
    }

    public ProviderResilience getResilience() {
        return resilience;
    }

    /**
     * Joins a base URL and a path, ignoring a trailing slash on the base.
     */
    static URI resolve(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + path);
    }
}
