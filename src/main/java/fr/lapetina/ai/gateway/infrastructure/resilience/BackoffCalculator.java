package fr.lapetina.ai.gateway.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff with optional jitter, expressed as a Resilience4j {@link IntervalFunction}.
 *
 * <pre>
 * delay  = min(baseDelay * multiplier^(attempt-1), maxDelay)
 * jitter = uniform offset in [-25%, +25%] of delay
 * </pre>
 *
 * Example with base=100ms, multiplier=2, max=1000ms, no jitter:
 * attempt 1 = 100ms, 2 = 200ms, 3 = 400ms, 4 = 800ms, 5+ = 1000ms.
 *
 * Delays are never shorter than 1ms: the scheduler treats a zero delay as "do not retry".
 */
public final class BackoffCalculator {

    static final double JITTER_RATIO = 0.25;
    static final long MIN_INTERVAL_MS = 1;

    /**
     * Builds the interval function for a policy.
     */
    public IntervalFunction intervalFunction(RetryPolicy policy) {
        long base = Math.max(MIN_INTERVAL_MS, policy.getBaseDelay().toMillis());
        long max = Math.max(base, policy.getMaxDelay().toMillis());

        IntervalFunction backoff = policy.isJitter()
                ? IntervalFunction.ofExponentialRandomBackoff(base, policy.getBackoffMultiplier(), JITTER_RATIO, max)
                : IntervalFunction.ofExponentialBackoff(base, policy.getBackoffMultiplier(), max);

        return attempt -> Math.max(MIN_INTERVAL_MS, backoff.apply(attempt));
    }

    /**
     * Computes the delay to wait after the given failed attempt.
     *
     * @param attempt 1-based attempt number that just failed
     * @param policy  policy providing base, multiplier, cap and jitter flag
     * @return delay before the next attempt
     */
    public Duration delay(int attempt, RetryPolicy policy) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        return Duration.ofMillis(intervalFunction(policy).apply(attempt));
    }
}
