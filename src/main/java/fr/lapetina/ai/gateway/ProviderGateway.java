package fr.lapetina.ai.gateway;

import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.domain.provider.ChatProvider;
import fr.lapetina.ai.gateway.domain.provider.ProviderFactory;
import fr.lapetina.ai.gateway.domain.provider.ProviderRegistry;
import fr.lapetina.ai.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.ai.gateway.infrastructure.config.ConfigurationValidator;
import fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig;
import fr.lapetina.ai.gateway.infrastructure.config.ValidationResult;
import fr.lapetina.ai.gateway.infrastructure.http.AzureOpenAiChatProvider;
import fr.lapetina.ai.gateway.infrastructure.http.OpenAiChatProvider;
import fr.lapetina.ai.gateway.infrastructure.metrics.GatewayMetrics;
import fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.ai.gateway.infrastructure.resilience.ErrorClassifier;
import fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience;
import fr.lapetina.ai.gateway.infrastructure.resilience.RateLimitedExecutor;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryExecutor;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Fully-wired gateway built from configuration.
 * This is the primary entry point for obtaining a configured {@link ChatProvider}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ProviderGateway gateway = ProviderGateway.create("gateway.yaml")) {
 *     ChatCompletionResponse response = gateway.chat(
 *             ChatCompletionRequest.ofPrompt("gpt-4o", "Hello!")).join();
 * }
 * }</pre>
 */
public class ProviderGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

    private final ProviderConfig config;
    private final GatewayMetrics metrics;
    private final HttpClient httpClient;
    private final RetryExecutor retryExecutor;
    private final ProviderRegistry registry;
    private final ProviderFactory factory;
    private final Map<String, ProviderResilience> resilienceByProvider = new ConcurrentHashMap<>();

    private volatile ChatProvider provider;

    protected ProviderGateway(ProviderConfig config, HttpClient httpClientOverride) {
        log.info("Initializing ProviderGateway: provider={}", config.getProvider());

        this.config = config;

        // Initialize metrics
        this.metrics = new GatewayMetrics(config.getMetrics().getPrefix());

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        RetryListener listener = config.getMetrics().isEnabled()
                ? RetryListener.logging().andThen(metrics)
                : RetryListener.logging();
        this.retryExecutor = new RetryExecutor(listener);

        // Registry is populated at start-up only
        this.registry = new ProviderRegistry();
        registerDefaults();

        this.factory = new ProviderFactory(registry);

        log.info("ProviderGateway initialized: registered={}", registry.list());
    }

    /**
     * Creates a gateway from the specified YAML configuration file.
     *
     * @throws GatewayException CONFIGURATION_MISSING if the configuration is incomplete
     */
    public static ProviderGateway create(String configPath) {
        ProviderConfig config = new ConfigLoader(configPath).load();
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new GatewayException(ErrorKind.CONFIGURATION_MISSING,
                    "Invalid configuration in " + configPath + ": " + String.join("; ", errors));
        }
        return new ProviderGateway(config, null);
    }

    /**
     * Creates a gateway from environment variables, after rejecting legacy or incomplete setups.
     *
     * @throws GatewayException CONFIGURATION_DEPRECATED or CONFIGURATION_MISSING with remediation text
     */
    public static ProviderGateway fromEnvironment(Map<String, String> env) {
        ConfigurationValidator validator = new ConfigurationValidator(env);
        ValidationResult result = validator.validateSafely();
        for (String warning : result.warnings()) {
            log.warn("Configuration warning: {}", warning);
        }
        validator.validateEnvironment();
        return new ProviderGateway(ConfigLoader.fromEnvironment(env), null);
    }

    private HttpClient createHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    private void registerDefaults() {
        registry.register(ProviderConfig.OPENAI,
                (ProviderConfig cfg) -> new OpenAiChatProvider(cfg, httpClient, resilienceFor(ProviderConfig.OPENAI, cfg)));
        registry.register(ProviderConfig.AZURE,
                (ProviderConfig cfg) -> new AzureOpenAiChatProvider(cfg, httpClient, resilienceFor(ProviderConfig.AZURE, cfg)));
    }

    /**
     * One resilience chain per provider name, shared by every instance created under that name.
     */
    ProviderResilience resilienceFor(String name, ProviderConfig cfg) {
        return resilienceByProvider.computeIfAbsent(name, n -> {
            CircuitBreaker circuitBreaker = new CircuitBreaker(n, cfg.getCircuitBreaker().toConfig());
            RateLimitedExecutor rateLimiter = null;
            if (cfg.getRateLimit().isEnabled()) {
                rateLimiter = new RateLimitedExecutor(
                        Duration.ofMillis(cfg.getRateLimit().getMinIntervalMs()), retryExecutor);
            }

            if (cfg.getMetrics().isEnabled()) {
                metrics.registerCircuitBreaker(circuitBreaker);
                if (rateLimiter != null) {
                    metrics.registerQueue(n, rateLimiter);
                }
            }

            log.info("Resilience chain created: provider={}, retry={}, circuitBreaker={}, rateLimited={}",
                    n, cfg.getRetry().getMaxAttempts(), cfg.getCircuitBreaker().getFailureThreshold(),
                    rateLimiter != null);
            return new ProviderResilience(circuitBreaker, retryExecutor, cfg.getRetry().toPolicy(), rateLimiter);
        });
    }

    /**
     * Returns the configured provider, creating it on first use without contacting the backend.
     */
    public ChatProvider getProvider() {
        ChatProvider current = provider;
        if (current == null) {
            synchronized (this) {
                current = provider;
                if (current == null) {
                    current = factory.create(config);
                    provider = current;
                }
            }
        }
        return current;
    }

    /**
     * Creates the configured provider and checks its credentials against the backend, retrying
     * with the factory's linear backoff. The validated provider replaces any cached one.
     */
    public CompletableFuture<ChatProvider> connect() {
        return factory.createWithRetry(config).thenApply(created -> {
            synchronized (this) {
                provider = created;
            }
            log.info("Provider connected: name={}", created.name());
            return created;
        });
    }

    /**
     * Sends a chat completion through the configured provider, recording latency and errors.
     */
    public CompletableFuture<ChatCompletionResponse> chat(ChatCompletionRequest request) {
        ChatProvider current = getProvider();
        Instant start = Instant.now();

        return current.createChatCompletion(request).whenComplete((response, error) -> {
            if (!config.getMetrics().isEnabled()) {
                return;
            }
            if (error == null) {
                metrics.recordLatency(current.name(), request.model(), Duration.between(start, Instant.now()));
            } else {
                ErrorKind kind = ErrorClassifier.classify(error).orElse(ErrorKind.EXTERNAL_API_FAILURE);
                metrics.incrementErrorCount(current.name(), kind);
            }
        });
    }

    /**
     * Opens a streaming chat completion through the configured provider.
     * The caller must close the returned stream.
     */
    public Stream<ChatCompletionChunk> stream(ChatCompletionRequest request) {
        ChatProvider current = getProvider();
        try {
            return current.createStreamingChatCompletion(request);
        } catch (GatewayException e) {
            if (config.getMetrics().isEnabled()) {
                metrics.incrementErrorCount(current.name(), e.getKind());
            }
            throw e;
        }
    }

    public ProviderConfig getConfig() {
        return config;
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public ProviderFactory getFactory() {
        return factory;
    }

    public GatewayMetrics getMetrics() {
        return metrics;
    }

    /**
     * Resilience chain of a provider, or null if no provider of that name was created yet.
     */
    public ProviderResilience getResilience(String providerName) {
        return resilienceByProvider.get(providerName);
    }

    @Override
    public void close() {
        log.info("Shutting down ProviderGateway...");

        for (ProviderResilience resilience : resilienceByProvider.values()) {
            if (resilience.getRateLimiter() != null) {
                try {
                    resilience.getRateLimiter().close();
                } catch (Exception e) {
                    log.warn("Error closing rate limiter", e);
                }
            }
        }

        try {
            retryExecutor.close();
        } catch (Exception e) {
            log.warn("Error closing retry executor", e);
        }

        try {
            metrics.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ProviderGateway shut down");
    }
}
