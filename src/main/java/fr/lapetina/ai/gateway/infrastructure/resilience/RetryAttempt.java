package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;

import java.time.Duration;

/**
 * Structured record of a failed attempt that is about to be retried.
 *
 * @param attempt     1-based number of the attempt that failed
 * @param maxAttempts attempt budget of the policy
 * @param kind        classification of the failure
 * @param delay       backoff before the next attempt
 * @param error       the failure itself
 */
public record RetryAttempt(
        int attempt,
        int maxAttempts,
        ErrorKind kind,
        Duration delay,
        Throwable error
) {
}
