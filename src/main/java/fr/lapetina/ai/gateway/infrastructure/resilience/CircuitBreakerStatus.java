package fr.lapetina.ai.gateway.infrastructure.resilience;

import java.time.Instant;

/**
 * Read-only snapshot of a circuit breaker.
 *
 * @param lastFailureTime time of the last counted failure, or null if none since creation/reset
 */
public record CircuitBreakerStatus(
        CircuitBreaker.State state,
        int failureCount,
        Instant lastFailureTime,
        int successCount
) {
}
