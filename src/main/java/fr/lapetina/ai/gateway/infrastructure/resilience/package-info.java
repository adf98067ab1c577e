/**
 * Resilience primitives wrapped around every outbound provider call.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.RetryExecutor} - Bounded retry loop and batch retry</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.BackoffCalculator} - Exponential delay with jitter</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreaker} - CLOSED/OPEN/HALF_OPEN state machine</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.TimeoutGuard} - Deadline race for a pending future</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.RateLimitedExecutor} - Serial FIFO queue with minimum spacing</li>
 *   <li>{@link fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience} - Per-provider chain of the above</li>
 * </ul>
 *
 * <h2>Classification</h2>
 * <p>Retry and breaker decisions are made on {@link fr.lapetina.ai.gateway.domain.model.ErrorKind}
 * as computed by {@link fr.lapetina.ai.gateway.infrastructure.resilience.ErrorClassifier}.
 * Unclassified failures are never retried and never counted by a breaker.
 *
 * <h2>Cancellation</h2>
 * <p>A timeout abandons the wait but does not abort the underlying call.
 */
package fr.lapetina.ai.gateway.infrastructure.resilience;
