package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serial FIFO queue that runs one operation at a time with a minimum spacing
 * between dispatches, to stay under backend-side rate limits.
 *
 * Each queued operation is run through {@link RetryExecutor#retryWithBackoff}; the next
 * operation is only dispatched once the current one (retries included) has settled and
 * at least {@code minInterval} has passed since the previous dispatch.
 *
 * Queue and processing flag are guarded by the executor's monitor. Closing the executor
 * fails every operation still waiting for its turn with SERVICE_UNAVAILABLE.
 */
public final class RateLimitedExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedExecutor.class);

    private final Duration minInterval;
    private final RetryExecutor retryExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final boolean ownsScheduler;

    private final Deque<QueuedOperation> queue = new ArrayDeque<>();
    private boolean processing;
    private boolean closed;
    private long lastDispatchMillis = Long.MIN_VALUE;

    public RateLimitedExecutor(
            Duration minInterval,
            RetryExecutor retryExecutor,
            ScheduledExecutorService scheduler,
            Clock clock
    ) {
        this(minInterval, retryExecutor, scheduler, clock, false);
    }

    public RateLimitedExecutor(Duration minInterval, RetryExecutor retryExecutor) {
        this(minInterval, retryExecutor, DaemonThreads.scheduler("rate-limited"), Clock.systemUTC(), true);
    }

    private RateLimitedExecutor(
            Duration minInterval,
            RetryExecutor retryExecutor,
            ScheduledExecutorService scheduler,
            Clock clock,
            boolean ownsScheduler
    ) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minInterval = minInterval;
        this.retryExecutor = retryExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.ownsScheduler = ownsScheduler;
        log.info("RateLimitedExecutor initialized: minIntervalMs={}", minInterval.toMillis());
    }

    /**
     * Enqueues an operation.
     *
     * @return a future settled once the operation's turn has run (with retries)
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        CompletableFuture<T> result = new CompletableFuture<>();

        Runnable task = () -> retryExecutor.retryWithBackoff(operation, policy)
                .whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(ErrorClassifier.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                    scheduleNext();
                });

        boolean start;
        synchronized (this) {
            if (closed) {
                result.completeExceptionally(closedError());
                return result;
            }
            queue.addLast(new QueuedOperation(task, result));
            start = !processing;
            if (start) {
                processing = true;
            }
            log.debug("Operation queued: queueLength={}", queue.size());
        }

        if (start) {
            scheduleNext();
        }
        return result;
    }

    private void scheduleNext() {
        long waitMillis;
        synchronized (this) {
            if (closed || queue.isEmpty()) {
                processing = false;
                return;
            }
            long sinceLast = lastDispatchMillis == Long.MIN_VALUE
                    ? Long.MAX_VALUE
                    : clock.millis() - lastDispatchMillis;
            waitMillis = Math.max(0, minInterval.toMillis() - sinceLast);
        }

        if (waitMillis > 0) {
            log.debug("Waiting before next dispatch: waitMs={}", waitMillis);
        }
        try {
            scheduler.schedule(this::dispatch, waitMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler rejected the next dispatch, failing queued operations");
            failQueued();
        }
    }

    private void dispatch() {
        QueuedOperation next;
        synchronized (this) {
            next = closed ? null : queue.pollFirst();
            if (next == null) {
                processing = false;
                return;
            }
            lastDispatchMillis = clock.millis();
        }
        try {
            next.task().run();
        } catch (RuntimeException e) {
            log.error("Queued operation failed to start", e);
            scheduleNext();
        }
    }

    /**
     * Number of operations waiting for their turn (the running one excluded).
     */
    public synchronized int queueLength() {
        return queue.size();
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    private void failQueued() {
        List<QueuedOperation> dropped;
        synchronized (this) {
            dropped = List.copyOf(queue);
            queue.clear();
            processing = false;
        }
        for (QueuedOperation operation : dropped) {
            operation.result().completeExceptionally(closedError());
        }
    }

    private static GatewayException closedError() {
        return new GatewayException(ErrorKind.SERVICE_UNAVAILABLE, "Rate-limited queue is closed");
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        failQueued();
    }

    private record QueuedOperation(Runnable task, CompletableFuture<?> result) {
    }
}
