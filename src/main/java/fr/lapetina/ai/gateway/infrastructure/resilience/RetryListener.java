package fr.lapetina.ai.gateway.infrastructure.resilience;

/**
 * Receives a record for every retry scheduled by {@link RetryExecutor}.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * Called after an attempt failed with a retryable error, before the backoff sleep.
     */
    void onRetry(RetryAttempt attempt);

    /**
     * Listener that logs retries through SLF4J.
     */
    static RetryListener logging() {
        return LoggingRetryListener.INSTANCE;
    }

    /**
     * Returns a listener notifying this one, then {@code other}.
     */
    default RetryListener andThen(RetryListener other) {
        return attempt -> {
            onRetry(attempt);
            other.onRetry(attempt);
        };
    }
}
