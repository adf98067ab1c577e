package fr.lapetina.ai.gateway.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default retry sink: one WARN line per retry.
 */
final class LoggingRetryListener implements RetryListener {

    static final LoggingRetryListener INSTANCE = new LoggingRetryListener();

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private LoggingRetryListener() {
    }

    @Override
    public void onRetry(RetryAttempt attempt) {
        Throwable cause = ErrorClassifier.unwrap(attempt.error());
        log.warn("Attempt failed, retrying: attempt={}/{}, kind={}, delayMs={}, error={}",
                attempt.attempt(),
                attempt.maxAttempts(),
                attempt.kind(),
                attempt.delay().toMillis(),
                cause.getMessage());
    }
}
