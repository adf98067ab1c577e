package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable circuit breaker settings.
 *
 * @param failureThreshold counted failures that open the circuit
 * @param recoveryTimeout  time after the last counted failure before a trial call is let through
 * @param expectedKinds    error kinds that count as failures; other errors pass through uncounted
 * @param closeThreshold   consecutive HALF_OPEN successes that close the circuit
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        Set<ErrorKind> expectedKinds,
        int closeThreshold
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofMinutes(1);
    public static final int DEFAULT_CLOSE_THRESHOLD = 3;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1 (current: " + failureThreshold + ")");
        }
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout is required");
        if (closeThreshold < 1) {
            throw new IllegalArgumentException("closeThreshold must be >= 1 (current: " + closeThreshold + ")");
        }
        expectedKinds = expectedKinds == null || expectedKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(expectedKinds);
    }

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {
        this(failureThreshold, recoveryTimeout, defaultExpectedKinds(), DEFAULT_CLOSE_THRESHOLD);
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT);
    }

    public static Set<ErrorKind> defaultExpectedKinds() {
        return EnumSet.of(ErrorKind.NETWORK_FAILURE, ErrorKind.TIMEOUT, ErrorKind.EXTERNAL_API_FAILURE);
    }

    public boolean isExpected(ErrorKind kind) {
        return kind != null && expectedKinds.contains(kind);
    }
}
