package fr.lapetina.ai.gateway.domain.provider;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.infrastructure.config.ProviderConfig;
import fr.lapetina.ai.gateway.infrastructure.resilience.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Creates providers from configuration through a {@link ProviderRegistry}.
 *
 * All creation failures are {@link GatewayException}s of kind CONFIGURATION_MISSING,
 * except validation and retry failures which keep the kind of their cause.
 */
public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private final ProviderRegistry registry;
    private final Function<Duration, Executor> delayedExecutor;

    /**
     * @param registry        constructors by provider name
     * @param delayedExecutor executor that starts its tasks after the given delay, used
     *                        between {@link #createWithRetry} attempts
     */
    public ProviderFactory(ProviderRegistry registry, Function<Duration, Executor> delayedExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.delayedExecutor = Objects.requireNonNull(delayedExecutor, "delayedExecutor is required");
    }

    public ProviderFactory(ProviderRegistry registry) {
        this(registry, delay -> CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Creates the provider selected by the configuration's {@code provider} tag.
     *
     * @throws GatewayException CONFIGURATION_MISSING when the tag is unknown, its section is
     *                          absent, or no constructor is registered for it
     */
    public ChatProvider create(ProviderConfig config) {
        String tag = config.getProvider();
        if (ProviderConfig.OPENAI.equals(tag)) {
            if (config.getOpenai() == null) {
                throw missing("OpenAI configuration is required when using OpenAI provider");
            }
            return createOpenAi(config);
        }
        if (ProviderConfig.AZURE.equals(tag)) {
            if (config.getAzure() == null) {
                throw missing("Azure configuration is required when using Azure provider");
            }
            return createAzure(config);
        }
        throw missing("Unsupported provider: " + tag);
    }

    public ChatProvider createOpenAi(ProviderConfig config) {
        return instantiate(ProviderConfig.OPENAI, "OpenAI", config);
    }

    public ChatProvider createAzure(ProviderConfig config) {
        return instantiate(ProviderConfig.AZURE, "Azure OpenAI", config);
    }

    private ChatProvider instantiate(String name, String displayName, ProviderConfig config) {
        ProviderConstructor<ProviderConfig> constructor = registry.<ProviderConfig>get(name)
                .orElseThrow(() -> missing(displayName + " provider is not registered. Make sure to register it first."));

        ChatProvider provider = constructor.create(config);
        log.info("Provider created: name={}, defaultModel={}", name, config.getDefaultModel());
        return provider;
    }

    /**
     * Returns the names of all registered providers.
     */
    public List<String> supportedProviders() {
        return registry.list();
    }

    /**
     * Creates the provider, then checks its credentials against the backend.
     *
     * @return future completed with the provider, or failed when {@code validateConfiguration()}
     *         answers false or fails
     */
    public CompletableFuture<ChatProvider> createWithValidation(ProviderConfig config) {
        ChatProvider provider;
        try {
            provider = create(config);
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }

        return provider.validateConfiguration().thenApply(valid -> {
            if (!Boolean.TRUE.equals(valid)) {
                log.warn("Provider configuration rejected: name={}", provider.name());
                throw new GatewayException(
                        ErrorKind.CONFIGURATION_MISSING,
                        "Provider " + config.getProvider() + " configuration validation failed",
                        provider.name(),
                        null
                );
            }
            return provider;
        });
    }

    public CompletableFuture<ChatProvider> createWithRetry(ProviderConfig config) {
        return createWithRetry(config, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }

    /**
     * Calls {@link #createWithValidation} up to {@code maxAttempts} times, waiting
     * {@code delay * attempt} after each failed attempt.
     *
     * @return future failed with "Failed to create provider after N attempts" once all attempts
     *         failed, the last error attached as cause
     */
    public CompletableFuture<ChatProvider> createWithRetry(ProviderConfig config, int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }

        return attempt(config, 1, maxAttempts, delay);
    }

    private CompletableFuture<ChatProvider> attempt(ProviderConfig config, int attempt, int maxAttempts, Duration delay) {
        CompletableFuture<ChatProvider> validated;
        try {
            validated = createWithValidation(config);
        } catch (RuntimeException e) {
            validated = CompletableFuture.failedFuture(e);
        }

        return validated
                .handle((provider, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(provider);
                    }

                    Throwable cause = ErrorClassifier.unwrap(error);
                    log.warn("Provider creation failed: provider={}, attempt={}/{}, error={}",
                            config.getProvider(), attempt, maxAttempts, cause.getMessage());

                    if (attempt >= maxAttempts) {
                        return CompletableFuture.<ChatProvider>failedFuture(exhausted(config, maxAttempts, cause));
                    }

                    // Linear backoff: delay * attempt
                    Executor wait = delayedExecutor.apply(delay.multipliedBy(attempt));
                    return CompletableFuture.runAsync(() -> { }, wait)
                            .thenCompose(ignored -> attempt(config, attempt + 1, maxAttempts, delay));
                })
                .thenCompose(Function.identity());
    }

    private static GatewayException exhausted(ProviderConfig config, int maxAttempts, Throwable lastError) {
        ErrorKind kind = ErrorClassifier.classify(lastError).orElse(ErrorKind.CONFIGURATION_MISSING);
        return new GatewayException(
                kind,
                "Failed to create provider after " + maxAttempts + " attempts. Last error: "
                        + (lastError.getMessage() != null ? lastError.getMessage() : "Unknown error"),
                config.getProvider(),
                null,
                lastError
        );
    }

    private static GatewayException missing(String message) {
        return new GatewayException(ErrorKind.CONFIGURATION_MISSING, message);
    }
}
