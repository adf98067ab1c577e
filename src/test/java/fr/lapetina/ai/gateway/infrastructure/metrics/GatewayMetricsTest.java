package fr.lapetina.ai.gateway.infrastructure.metrics;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.ai.gateway.infrastructure.resilience.CircuitBreakerConfig;
import fr.lapetina.ai.gateway.infrastructure.resilience.RateLimitedExecutor;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryAttempt;
import fr.lapetina.ai.gateway.infrastructure.resilience.RetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class GatewayMetricsTest {

    private GatewayMetrics metrics;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new GatewayMetrics("test");
        registry = metrics.getRegistry();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count retries by error kind")
    void shouldCountRetries() {
        GatewayException error = new GatewayException(ErrorKind.TIMEOUT, "slow");

        metrics.onRetry(new RetryAttempt(1, 3, ErrorKind.TIMEOUT, Duration.ofMillis(100), error));
        metrics.onRetry(new RetryAttempt(2, 3, ErrorKind.TIMEOUT, Duration.ofMillis(200), error));
        metrics.onRetry(new RetryAttempt(1, 3, ErrorKind.RATE_LIMITED, Duration.ofMillis(100), error));

        assertThat(registry.get("test_retries_total").tag("kind", "TIMEOUT").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_retries_total").tag("kind", "RATE_LIMITED").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record completion latency per provider and model")
    void shouldRecordLatency() {
        metrics.recordLatency("openai", "gpt-4o", Duration.ofMillis(120));
        metrics.recordLatency("openai", "gpt-4o", Duration.ofMillis(80));

        Timer timer = registry.get("test_completion_latency")
                .tag("provider", "openai")
                .tag("model", "gpt-4o")
                .timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    @DisplayName("should count errors and open-circuit rejections")
    void shouldCountErrors() {
        metrics.incrementErrorCount("azure", ErrorKind.NETWORK_FAILURE);
        metrics.incrementErrorCount("azure", ErrorKind.SERVICE_UNAVAILABLE);
        metrics.incrementErrorCount("azure", ErrorKind.SERVICE_UNAVAILABLE);

        assertThat(registry.get("test_errors_total").tag("provider", "azure").tag("kind", "NETWORK_FAILURE")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_errors_total").tag("kind", "SERVICE_UNAVAILABLE")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_circuit_rejections_total").tag("breaker", "azure")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should expose circuit breaker state as a gauge")
    void shouldTrackCircuitState() {
        CircuitBreaker circuitBreaker = new CircuitBreaker("openai", new CircuitBreakerConfig(1, Duration.ofMinutes(1)));
        metrics.registerCircuitBreaker(circuitBreaker);

        assertThat(registry.get("test_circuit_state").tag("breaker", "openai").gauge().value()).isEqualTo(0.0);

        catchThrowable(() -> circuitBreaker.execute(() -> CompletableFuture.<String>failedFuture(
                new GatewayException(ErrorKind.NETWORK_FAILURE, "down"))).join());

        assertThat(registry.get("test_circuit_state").tag("breaker", "openai").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should expose queue depth as a gauge")
    void shouldTrackQueueDepth() {
        try (RetryExecutor retryExecutor = new RetryExecutor(metrics);
             RateLimitedExecutor queue = new RateLimitedExecutor(Duration.ofMillis(10), retryExecutor)) {
            metrics.registerQueue("openai", queue);

            assertThat(registry.get("test_queue_depth").tag("queue", "openai").gauge().value()).isZero();
        }
    }

    @Test
    @DisplayName("should render metrics in Prometheus format")
    void shouldScrape() {
        metrics.recordLatency("openai", "gpt-4o", Duration.ofMillis(50));
        metrics.incrementErrorCount("openai", ErrorKind.TIMEOUT);

        String scrape = metrics.scrape();

        assertThat(scrape)
                .contains("test_completion_latency_seconds")
                .contains("test_errors_total")
                .contains("jvm_memory_used_bytes");
    }
}
