package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Races an asynchronous operation against a deadline.
 *
 * If the timer fires first the returned future fails with a TIMEOUT {@link GatewayException}
 * reporting the time actually waited.
 * If the operation settles first the timer is cancelled and the outcome is passed through.
 * The operation itself is never cancelled: only the caller's wait is abandoned, so an
 * in-flight HTTP call keeps running until the backend answers.
 */
public final class TimeoutGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public TimeoutGuard(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        this.ownsScheduler = false;
    }

    public TimeoutGuard() {
        this.scheduler = DaemonThreads.scheduler("timeout-guard");
        this.ownsScheduler = true;
    }

    /**
     * Wraps {@code operation} with a deadline.
     *
     * @param operation the pending operation
     * @param timeout   maximum time to wait
     * @return a future settled by whichever of the operation or the timer finishes first
     */
    public <T> CompletableFuture<T> withTimeout(CompletableFuture<T> operation, Duration timeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        long startNanos = System.nanoTime();

        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (result.completeExceptionally(new GatewayException(
                    ErrorKind.TIMEOUT,
                    "Operation timed out after " + elapsedMs + "ms"))) {
                log.debug("Timeout fired: timeoutMs={}, elapsedMs={}", timeout.toMillis(), elapsedMs);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        operation.whenComplete((value, error) -> {
            timer.cancel(false);
            if (error != null) {
                result.completeExceptionally(ErrorClassifier.unwrap(error));
            } else {
                result.complete(value);
            }
        });

        return result;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
