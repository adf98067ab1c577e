package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@Timeout(5)
class TimeoutGuardTest {

    private TimeoutGuard guard;

    @BeforeEach
    void setUp() {
        guard = new TimeoutGuard();
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    @DisplayName("should pass through a value that arrives before the deadline")
    void shouldPassThroughValue() {
        CompletableFuture<String> result = guard.withTimeout(
                CompletableFuture.completedFuture("fast"), Duration.ofSeconds(1));

        assertThat(result.join()).isEqualTo("fast");
    }

    @Test
    @DisplayName("should pass through a failure that arrives before the deadline")
    void shouldPassThroughFailure() {
        GatewayException error = new GatewayException(ErrorKind.NETWORK_FAILURE, "refused");

        Throwable thrown = catchThrowable(() -> guard.withTimeout(
                CompletableFuture.failedFuture(error), Duration.ofSeconds(1)).join());

        assertThat(thrown.getCause()).isSameAs(error);
    }

    @Test
    @DisplayName("should fail with TIMEOUT when the operation never settles")
    void shouldFailWithTimeout() {
        Throwable thrown = catchThrowable(() -> guard.withTimeout(
                new CompletableFuture<String>(), Duration.ofMillis(50)).join());

        assertThat(thrown.getCause())
                .isInstanceOf(GatewayException.class)
                .hasMessageMatching("Operation timed out after \\d+ms");
        assertThat(((GatewayException) thrown.getCause()).getKind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("should report the time actually waited in the timeout message")
    void shouldReportElapsedTime() {
        Throwable thrown = catchThrowable(() -> guard.withTimeout(
                new CompletableFuture<String>(), Duration.ofMillis(80)).join());

        String message = thrown.getCause().getMessage();
        long elapsedMs = Long.parseLong(message.replaceAll("\\D", ""));

        assertThat(elapsedMs).isGreaterThanOrEqualTo(80);
    }

    @Test
    @DisplayName("should leave the underlying operation running after a timeout")
    void shouldNotCancelUnderlyingOperation() {
        CompletableFuture<String> operation = new CompletableFuture<>();

        catchThrowable(() -> guard.withTimeout(operation, Duration.ofMillis(20)).join());

        assertThat(operation.isCancelled()).isFalse();
        assertThat(operation.complete("late")).isTrue();
    }

    @Test
    @DisplayName("should ignore a value that arrives after the deadline")
    void shouldIgnoreLateValue() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> guarded = guard.withTimeout(operation, Duration.ofMillis(20));

        catchThrowable(guarded::join);
        operation.complete("late");

        assertThat(guarded.isCompletedExceptionally()).isTrue();
    }
}
