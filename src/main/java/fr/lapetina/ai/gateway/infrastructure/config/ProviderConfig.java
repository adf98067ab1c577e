package fr.lapetina.ai.gateway.infrastructure.config;

import fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreakerConfig;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML or from environment variables.
 *
 * The {@code provider} tag selects which of the {@code openai} / {@code azure}
 * sections the factory uses; any string is accepted here so that unknown tags
 * can be reported by the factory.
 */
public class ProviderConfig {

    public static final String OPENAI = "openai";
    public static final String AZURE = "azure";

    private String provider = OPENAI;
    private String defaultModel = "gpt-4o";
    private boolean enableReasoning = false;
    private long timeoutMs = 100000;
    private OpenAiSettings openai;
    private AzureSettings azure;
    private RetrySettings retry = new RetrySettings();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private RateLimitSettings rateLimit = new RateLimitSettings();
    private MetricsSettings metrics = new MetricsSettings();

    // Getters and Setters
    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

    public boolean isEnableReasoning() { return enableReasoning; }
    public void setEnableReasoning(boolean enableReasoning) { this.enableReasoning = enableReasoning; }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public OpenAiSettings getOpenai() { return openai; }
    public void setOpenai(OpenAiSettings openai) { this.openai = openai; }

    public AzureSettings getAzure() { return azure; }
    public void setAzure(AzureSettings azure) { this.azure = azure; }

    public RetrySettings getRetry() { return retry; }
    public void setRetry(RetrySettings retry) { this.retry = retry; }

    public CircuitBreakerSettings getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RateLimitSettings getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitSettings rateLimit) { this.rateLimit = rateLimit; }

    public MetricsSettings getMetrics() { return metrics; }
    public void setMetrics(MetricsSettings metrics) { this.metrics = metrics; }

    public Duration getTimeout() {
        return Duration.ofMillis(timeoutMs);
    }

    /**
     * Lists configuration problems without throwing.
     *
     * @return error messages, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (provider == null || provider.isBlank()) {
            errors.add("AI provider is required");
        }

        if (OPENAI.equals(provider) && (openai == null || isBlank(openai.getApiKey()))) {
            errors.add("OpenAI API key is required when using OpenAI provider");
        }

        if (AZURE.equals(provider)) {
            if (azure == null || isBlank(azure.getApiKey())) {
                errors.add("Azure API key is required when using Azure provider");
            }
            if (azure == null || isBlank(azure.getEndpoint())) {
                errors.add("Azure endpoint is required when using Azure provider");
            }
            if (azure == null || isBlank(azure.getDeployment())) {
                errors.add("Azure deployment is required when using Azure provider");
            }
            if (azure == null || isBlank(azure.getApiVersion())) {
                errors.add("Azure API version is required when using Azure provider");
            }
        }

        if (isBlank(defaultModel)) {
            errors.add("Default model is required");
        }

        if (timeoutMs <= 0) {
            errors.add("Timeout must be greater than 0");
        }

        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * OpenAI API settings.
     */
    public static class OpenAiSettings {
        private String apiKey;
        private String baseUrl;
        private String organization;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getOrganization() { return organization; }
        public void setOrganization(String organization) { this.organization = organization; }
    }

    /**
     * Azure OpenAI deployment settings.
     */
    public static class AzureSettings {
        public static final String DEFAULT_API_VERSION = "2024-02-15-preview";

        private String apiKey;
        private String endpoint;
        private String deployment;
        private String apiVersion = DEFAULT_API_VERSION;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getDeployment() { return deployment; }
        public void setDeployment(String deployment) { this.deployment = deployment; }

        public String getApiVersion() { return apiVersion; }
        public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }
    }

    /**
     * Retry configuration for outbound calls.
     */
    public static class RetrySettings {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;
        private long attemptTimeoutMs = 60000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }

        /** Per-attempt timeout, 0 to disable. */
        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .baseDelay(Duration.ofMillis(baseDelayMs))
                    .maxDelay(Duration.ofMillis(maxDelayMs))
                    .backoffMultiplier(backoffMultiplier)
                    .jitter(jitter)
                    .timeout(attemptTimeoutMs > 0 ? Duration.ofMillis(attemptTimeoutMs) : null)
                    .build();
        }
    }

    /**
     * Circuit breaker configuration.
     */
    public static class CircuitBreakerSettings {
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;
        private long recoveryTimeoutMs = CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT.toMillis();
        private int closeThreshold = CircuitBreakerConfig.DEFAULT_CLOSE_THRESHOLD;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }

        public int getCloseThreshold() { return closeThreshold; }
        public void setCloseThreshold(int closeThreshold) { this.closeThreshold = closeThreshold; }

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(
                    failureThreshold,
                    Duration.ofMillis(recoveryTimeoutMs),
                    CircuitBreakerConfig.defaultExpectedKinds(),
                    closeThreshold
            );
        }
    }

    /**
     * Serial rate-limited dispatch of outbound calls.
     */
    public static class RateLimitSettings {
        private boolean enabled = false;
        private long minIntervalMs = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getMinIntervalMs() { return minIntervalMs; }
        public void setMinIntervalMs(long minIntervalMs) { this.minIntervalMs = minIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsSettings {
        private boolean enabled = true;
        private String prefix = "ai_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
