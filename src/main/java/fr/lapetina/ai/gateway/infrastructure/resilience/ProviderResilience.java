package fr.lapetina.ai.gateway.infrastructure.resilience;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Resilience chain guarding the outbound calls of one provider.
 *
 * <pre>
 * [rate-limited queue] -> retry(policy) -> circuit breaker -> call
 * </pre>
 *
 * Every attempt passes through the breaker, so once it opens the remaining attempts are
 * rejected with SERVICE_UNAVAILABLE, which the default policies do not retry.
 */
public final class ProviderResilience {

    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final RateLimitedExecutor rateLimiter;

    public ProviderResilience(
            CircuitBreaker circuitBreaker,
            RetryExecutor retryExecutor,
            RetryPolicy retryPolicy,
            RateLimitedExecutor rateLimiter
    ) {
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker is required");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.rateLimiter = rateLimiter;
    }

    public ProviderResilience(CircuitBreaker circuitBreaker, RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this(circuitBreaker, retryExecutor, retryPolicy, null);
    }

    /**
     * Runs a call through the chain with the default policy.
     */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        return call(operation, retryPolicy);
    }

    /**
     * Runs a call through the chain with a specific policy (e.g. fewer attempts for streaming).
     */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        Supplier<CompletableFuture<T>> guarded = () -> circuitBreaker.execute(operation);
        if (rateLimiter != null) {
            return rateLimiter.execute(guarded, policy);
        }
        return retryExecutor.retryWithBackoff(guarded, policy);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * The rate-limited queue, or null when calls are not serialized.
     */
    public RateLimitedExecutor getRateLimiter() {
        return rateLimiter;
    }
}
