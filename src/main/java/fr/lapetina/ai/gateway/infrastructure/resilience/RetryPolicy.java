package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable retry policy: attempt budget, exponential backoff parameters and
 * the error kinds that are worth retrying.
 */
public final class RetryPolicy {

    private static final Set<ErrorKind> DEFAULT_RETRYABLE = EnumSet.of(
            ErrorKind.NETWORK_FAILURE,
            ErrorKind.TIMEOUT,
            ErrorKind.EXTERNAL_API_FAILURE,
            ErrorKind.RATE_LIMITED
    );

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final boolean jitter;
    private final Set<ErrorKind> retryableKinds;
    private final Duration timeout;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + builder.maxAttempts + ")");
        }
        if (builder.baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (builder.maxDelay.compareTo(builder.baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (base: " + builder.baseDelay + ", max: " + builder.maxDelay + ")"
            );
        }
        if (builder.backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0 (current: " + builder.backoffMultiplier + ")");
        }
        if (builder.timeout != null && (builder.timeout.isZero() || builder.timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive when set");
        }
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitter = builder.jitter;
        this.retryableKinds = builder.retryableKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(builder.retryableKinds));
        this.timeout = builder.timeout;
    }

    /**
     * 3 attempts, 1s base delay doubling up to 30s, jitter on, no per-attempt timeout.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .retryableKinds(retryableKinds)
                .timeout(timeout);
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind != null && retryableKinds.contains(kind);
    }

    public int getMaxAttempts() { return maxAttempts; }

    public Duration getBaseDelay() { return baseDelay; }

    public Duration getMaxDelay() { return maxDelay; }

    public double getBackoffMultiplier() { return backoffMultiplier; }

    public boolean isJitter() { return jitter; }

    public Set<ErrorKind> getRetryableKinds() { return retryableKinds; }

    /**
     * Per-attempt deadline, or null when attempts are not time-boxed.
     */
    public Duration getTimeout() { return timeout; }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", baseDelay=" + baseDelay.toMillis() + "ms" +
                ", maxDelay=" + maxDelay.toMillis() + "ms" +
                ", multiplier=" + backoffMultiplier +
                ", jitter=" + jitter +
                ", retryable=" + retryableKinds +
                (timeout != null ? ", timeout=" + timeout.toMillis() + "ms" : "") +
                '}';
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;
        private Set<ErrorKind> retryableKinds = EnumSet.copyOf(DEFAULT_RETRYABLE);
        private Duration timeout;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay);
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder retryableKinds(Set<ErrorKind> retryableKinds) {
            this.retryableKinds = retryableKinds.isEmpty()
                    ? EnumSet.noneOf(ErrorKind.class)
                    : EnumSet.copyOf(retryableKinds);
            return this;
        }

        public Builder retryOn(ErrorKind... kinds) {
            for (ErrorKind kind : kinds) {
                this.retryableKinds.add(kind);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
