package fr.lapetina.ai.gateway.infrastructure.metrics;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.ai.gateway.infrastructure.resilience.RateLimitedExecutor;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryAttempt;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gateway metrics backed by a Micrometer Prometheus registry.
 *
 * Provides:
 * - Completion latency timers per provider and model
 * - Error counters per provider and error kind
 * - Retry counters per error kind (as a {@link RetryListener})
 * - Circuit breaker state gauges and rejection counters
 * - Rate-limited queue depth gauges
 * - Prometheus exposition
 */
public final class GatewayMetrics implements RetryListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();

    public GatewayMetrics(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        log.info("GatewayMetrics initialized with prefix: {}", prefix);
    }

    public GatewayMetrics() {
        this("ai_gateway");
    }

    /**
     * Counts a scheduled retry by the kind of error that triggered it.
     */
    @Override
    public void onRetry(RetryAttempt attempt) {
        retryCounters.computeIfAbsent(attempt.kind(), kind ->
                Counter.builder(prefix + "_retries_total")
                        .description("Total number of retries scheduled")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of a completed chat completion call.
     */
    public void recordLatency(String provider, String model, Duration latency) {
        String key = provider + ":" + model;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_completion_latency")
                        .description("Chat completion latency")
                        .tag("provider", provider)
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the error counter; open-circuit rejections are also counted per breaker.
     */
    public void incrementErrorCount(String provider, ErrorKind kind) {
        String key = provider + ":" + kind.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed calls")
                        .tag("provider", provider)
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();

        if (kind == ErrorKind.SERVICE_UNAVAILABLE) {
            incrementCircuitRejections(provider);
        }
    }

    public void incrementCircuitRejections(String breakerName) {
        rejectionCounters.computeIfAbsent(breakerName, k ->
                Counter.builder(prefix + "_circuit_rejections_total")
                        .description("Calls rejected by an open circuit breaker")
                        .tag("breaker", breakerName)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a circuit breaker's state (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     */
    public void registerCircuitBreaker(CircuitBreaker circuitBreaker) {
        Gauge.builder(prefix + "_circuit_state", circuitBreaker, GatewayMetrics::stateValue)
                .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                .tag("breaker", circuitBreaker.getName())
                .register(registry);
    }

    /**
     * Registers a gauge for the number of operations waiting in a rate-limited queue.
     */
    public void registerQueue(String name, RateLimitedExecutor executor) {
        Gauge.builder(prefix + "_queue_depth", executor, RateLimitedExecutor::queueLength)
                .description("Operations waiting in the rate-limited queue")
                .tag("queue", name)
                .register(registry);
    }

    static double stateValue(CircuitBreaker circuitBreaker) {
        return switch (circuitBreaker.getState()) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
