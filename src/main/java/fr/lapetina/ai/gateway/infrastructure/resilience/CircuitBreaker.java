package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Circuit breaker protecting one downstream dependency.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failure threshold reached, calls rejected without being invoked
 * - HALF_OPEN: Recovery timeout elapsed since the last failure, trial calls pass through
 *
 * The failure count is not reset when entering HALF_OPEN, so a single counted failure
 * during the trial window re-opens the circuit. Only errors whose kind is in
 * {@link CircuitBreakerConfig#expectedKinds()} are counted.
 *
 * Thread-safe: all state transitions happen under the breaker's monitor.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name) {
        this(name, CircuitBreakerConfig.defaults());
    }

    /**
     * Runs {@code operation} under circuit breaker protection.
     *
     * @return the operation's future, or a future failed with SERVICE_UNAVAILABLE
     *         when the circuit is open (the operation is then not invoked)
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        if (!tryAcquirePermission()) {
            log.debug("Call rejected by open circuit: name={}", name);
            return CompletableFuture.failedFuture(new GatewayException(
                    ErrorKind.SERVICE_UNAVAILABLE,
                    "Circuit breaker is OPEN - service temporarily unavailable: " + name
            ));
        }

        CompletableFuture<T> call;
        try {
            call = operation.get();
            if (call == null) {
                call = CompletableFuture.failedFuture(new NullPointerException("Operation returned no future"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess();
            } else {
                onFailure(error);
            }
        });
    }

    private synchronized boolean tryAcquirePermission() {
        if (state != State.OPEN) {
            return true;
        }
        Duration sinceLastFailure = Duration.between(lastFailureTime, clock.instant());
        if (sinceLastFailure.compareTo(config.recoveryTimeout()) < 0) {
            return false;
        }
        state = State.HALF_OPEN;
        successCount = 0;
        log.info("Circuit breaker transitioning to HALF_OPEN: name={}, failures={}", name, failureCount);
        return true;
    }

    private synchronized void onSuccess() {
        failureCount = 0;

        if (state == State.HALF_OPEN) {
            successCount++;
            if (successCount >= config.closeThreshold()) {
                state = State.CLOSED;
                log.info("Circuit breaker CLOSED after recovery: name={}, successes={}", name, successCount);
            }
        }
    }

    private synchronized void onFailure(Throwable error) {
        Optional<ErrorKind> kind = ErrorClassifier.classify(error);
        if (kind.isEmpty() || !config.isExpected(kind.get())) {
            return;
        }

        failureCount++;
        lastFailureTime = clock.instant();

        if (failureCount >= config.failureThreshold() && state != State.OPEN) {
            State previous = state;
            state = State.OPEN;
            log.warn("Circuit breaker OPENED: name={}, from={}, failures={}, kind={}",
                    name, previous, failureCount, kind.get());
        }
    }

    /**
     * Returns a consistent snapshot of the breaker's state.
     */
    public synchronized CircuitBreakerStatus getStatus() {
        return new CircuitBreakerStatus(state, failureCount, lastFailureTime, successCount);
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Forces the circuit CLOSED with all counters zeroed. For testing/admin use.
     */
    public synchronized void reset() {
        State old = state;
        state = State.CLOSED;
        failureCount = 0;
        successCount = 0;
        lastFailureTime = null;
        log.info("Circuit breaker reset from {}: name={}", old, name);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", failures=" + failureCount +
                '}';
    }
}
