package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@Timeout(10)
class RetryExecutorTest {

    private final List<RetryAttempt> retries = new CopyOnWriteArrayList<>();
    private RetryExecutor executor;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        executor = new RetryExecutor(retries::add);
        policy = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(20))
                .maxDelay(Duration.ofMillis(100))
                .jitter(false)
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("should return the value of a first successful attempt")
    void shouldSucceedOnFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }, policy).join();

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(1);
        assertThat(retries).isEmpty();
    }

    @Test
    @DisplayName("should retry transient failures until success")
    void shouldRetryUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.retryWithBackoff(() -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(
                        new GatewayException(ErrorKind.NETWORK_FAILURE, "connection reset"));
            }
            return CompletableFuture.completedFuture("recovered");
        }, policy).join();

        assertThat(result).isEqualTo("recovered");
        assertThat(calls).hasValue(3);
        assertThat(retries).hasSize(2);
        assertThat(retries.get(0).attempt()).isEqualTo(1);
        assertThat(retries.get(0).delay()).isEqualTo(Duration.ofMillis(20));
        assertThat(retries.get(1).attempt()).isEqualTo(2);
        assertThat(retries.get(1).delay()).isEqualTo(Duration.ofMillis(40));
        assertThat(retries).allSatisfy(retry -> {
            assertThat(retry.kind()).isEqualTo(ErrorKind.NETWORK_FAILURE);
            assertThat(retry.maxAttempts()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("should invoke exactly maxAttempts times and propagate the last error")
    void shouldExhaustAttempts() {
        AtomicInteger calls = new AtomicInteger();
        GatewayException last = new GatewayException(ErrorKind.TIMEOUT, "attempt 3");

        Throwable thrown = catchThrowable(() -> executor.retryWithBackoff(() -> {
            int call = calls.incrementAndGet();
            return CompletableFuture.failedFuture(
                    call == 3 ? last : new GatewayException(ErrorKind.TIMEOUT, "attempt " + call));
        }, policy).join());

        assertThat(calls).hasValue(3);
        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause()).isSameAs(last);
        assertThat(retries).hasSize(2);
    }

    @Test
    @DisplayName("should propagate unclassified errors without retrying")
    void shouldNotRetryUnclassifiedErrors() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException error = new IllegalStateException("bug");

        Throwable thrown = catchThrowable(() -> executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        }, policy).join());

        assertThat(calls).hasValue(1);
        assertThat(thrown.getCause()).isSameAs(error);
    }

    @Test
    @DisplayName("should never retry fatal kinds even when the policy lists them")
    void shouldNotRetryFatalKinds() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy permissive = policy.toBuilder().retryOn(ErrorKind.AUTHENTICATION_FAILURE).build();

        Throwable thrown = catchThrowable(() -> executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(
                    new GatewayException(ErrorKind.AUTHENTICATION_FAILURE, "bad key"));
        }, permissive).join());

        assertThat(calls).hasValue(1);
        assertThat(thrown.getCause()).isInstanceOf(GatewayException.class);
        assertThat(((GatewayException) thrown.getCause()).getKind()).isEqualTo(ErrorKind.AUTHENTICATION_FAILURE);
    }

    @Test
    @DisplayName("should not retry kinds outside the retryable set")
    void shouldNotRetryNonRetryableKinds() {
        AtomicInteger calls = new AtomicInteger();

        catchThrowable(() -> executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new GatewayException(ErrorKind.INVALID_REQUEST, "bad"));
        }, policy).join());

        assertThat(calls).hasValue(1);
        assertThat(retries).isEmpty();
    }

    @Test
    @DisplayName("should classify IOException as a network failure and retry it")
    void shouldRetryIoExceptions() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.retryWithBackoff(() -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IOException("broken pipe"));
            }
            return CompletableFuture.completedFuture("ok");
        }, policy).join();

        assertThat(result).isEqualTo("ok");
        assertThat(retries).singleElement()
                .satisfies(retry -> assertThat(retry.kind()).isEqualTo(ErrorKind.NETWORK_FAILURE));
    }

    @Test
    @DisplayName("should treat a supplier that throws as a failed attempt")
    void shouldHandleThrowingSupplier() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.retryWithBackoff(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new GatewayException(ErrorKind.EXTERNAL_API_FAILURE, "boom");
            }
            return CompletableFuture.completedFuture("ok");
        }, policy).join();

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("should time out hanging attempts and retry them")
    void shouldTimeOutHangingAttempts() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy timed = policy.toBuilder().maxAttempts(2).timeout(Duration.ofMillis(50)).build();

        Throwable thrown = catchThrowable(() -> executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return new CompletableFuture<String>();
        }, timed).join());

        assertThat(calls).hasValue(2);
        assertThat(thrown.getCause()).isInstanceOf(GatewayException.class);
        assertThat(((GatewayException) thrown.getCause()).getKind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("should keep notifying when a listener throws")
    void shouldSurviveFailingListener() {
        try (RetryExecutor failingListener = new RetryExecutor(attempt -> {
            throw new IllegalStateException("listener down");
        })) {
            AtomicInteger calls = new AtomicInteger();

            String result = failingListener.retryWithBackoff(() -> {
                if (calls.incrementAndGet() == 1) {
                    return CompletableFuture.failedFuture(new GatewayException(ErrorKind.RATE_LIMITED, "slow down"));
                }
                return CompletableFuture.completedFuture("ok");
            }, policy).join();

            assertThat(result).isEqualTo("ok");
        }
    }

    @Test
    @DisplayName("should fail a retry waiting on its backoff when closed")
    void shouldFailPendingBackoffOnClose() throws InterruptedException {
        RetryPolicy slow = policy.toBuilder()
                .baseDelay(Duration.ofMillis(200))
                .maxDelay(Duration.ofMillis(200))
                .build();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new GatewayException(ErrorKind.NETWORK_FAILURE, "down"));
        }, slow);

        Thread.sleep(50);
        executor.close();

        Throwable thrown = catchThrowable(() -> result.get(1, TimeUnit.SECONDS));
        assertThat(thrown.getCause()).isInstanceOf(GatewayException.class);
        assertThat(((GatewayException) thrown.getCause()).getKind()).isEqualTo(ErrorKind.SERVICE_UNAVAILABLE);
        assertThat(calls).hasValue(1);
        assertThat(executor.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should fail an in-flight attempt that completes after close")
    void shouldFailInFlightAttemptOnClose() {
        CompletableFuture<String> inFlight = new CompletableFuture<>();

        CompletableFuture<String> result = executor.retryWithBackoff(() -> inFlight, policy);
        executor.close();
        inFlight.completeExceptionally(new GatewayException(ErrorKind.NETWORK_FAILURE, "late failure"));

        Throwable thrown = catchThrowable(() -> result.get(1, TimeUnit.SECONDS));
        assertThat(thrown.getCause()).isInstanceOf(GatewayException.class);
        assertThat(((GatewayException) thrown.getCause()).getKind()).isEqualTo(ErrorKind.SERVICE_UNAVAILABLE);
        assertThat(retries).isEmpty();
    }

    @Test
    @DisplayName("should reject new work once closed")
    void shouldRejectAfterClose() {
        AtomicInteger calls = new AtomicInteger();
        executor.close();

        CompletableFuture<String> result = executor.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        }, policy);

        assertThat(result).isCompletedExceptionally();
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should settle every batch operation in input order")
    void shouldSettleBatchInOrder() {
        AtomicInteger flaky = new AtomicInteger();
        IllegalArgumentException permanent = new IllegalArgumentException("permanent");

        List<Supplier<CompletableFuture<String>>> operations = List.of(
                () -> CompletableFuture.completedFuture("first"),
                () -> CompletableFuture.failedFuture(permanent),
                () -> flaky.incrementAndGet() == 1
                        ? CompletableFuture.failedFuture(new GatewayException(ErrorKind.TIMEOUT, "slow"))
                        : CompletableFuture.completedFuture("third")
        );

        List<BatchOutcome<String>> outcomes = executor.retryBatch(operations, policy).join();

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(0).value()).isEqualTo("first");
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).failure()).isSameAs(permanent);
        assertThat(outcomes.get(2).value()).isEqualTo("third");
        assertThat(flaky).hasValue(2);
    }
}
