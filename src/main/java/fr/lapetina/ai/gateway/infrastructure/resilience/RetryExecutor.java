package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Bounded-attempt retry loop with exponential backoff, built on Resilience4j {@link Retry}.
 *
 * Each attempt obtains a fresh future from the operation supplier. Failures are
 * classified with {@link ErrorClassifier}; the loop stops and propagates the failure
 * unchanged when it is unclassified, fatal, not in the policy's retryable set, or when
 * the attempt budget is spent. Backoff sleeps are scheduled, never blocking a thread.
 *
 * Closing the executor fails every pending result with SERVICE_UNAVAILABLE.
 */
public final class RetryExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final String RETRY_NAME = "provider-call";

    private final ScheduledExecutorService scheduler;
    private final BackoffCalculator backoffCalculator;
    private final TimeoutGuard timeoutGuard;
    private final RetryListener listener;
    private final boolean ownsScheduler;

    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public RetryExecutor(
            ScheduledExecutorService scheduler,
            BackoffCalculator backoffCalculator,
            RetryListener listener
    ) {
        this(scheduler, backoffCalculator, listener, false);
    }

    public RetryExecutor(RetryListener listener) {
        this(DaemonThreads.scheduler("retry"), new BackoffCalculator(), listener, true);
    }

    public RetryExecutor() {
        this(RetryListener.logging());
    }

    private RetryExecutor(
            ScheduledExecutorService scheduler,
            BackoffCalculator backoffCalculator,
            RetryListener listener,
            boolean ownsScheduler
    ) {
        this.scheduler = scheduler;
        this.backoffCalculator = backoffCalculator;
        this.timeoutGuard = new TimeoutGuard(scheduler);
        this.listener = listener;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Runs {@code operation} until it succeeds or the policy says stop.
     *
     * @param operation supplies one attempt; called once per attempt
     * @param policy    retry policy
     * @return the first successful value, or the last failure unchanged
     */
    public <T> CompletableFuture<T> retryWithBackoff(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        CompletableFuture<T> result = new CompletableFuture<>();
        pending.add(result);
        result.whenComplete((value, error) -> pending.remove(result));
        if (closed) {
            result.completeExceptionally(closedError());
            return result;
        }

        Retry retry = Retry.of(RETRY_NAME, retryConfig(policy));
        retry.getEventPublisher()
                .onRetry(event -> onRetry(event, policy, result))
                .onError(event -> log.debug("Giving up after exhausting attempts: attempts={}/{}",
                        event.getNumberOfRetryAttempts(), policy.getMaxAttempts()))
                .onIgnoredError(event -> log.debug("Giving up on non-retryable error: kind={}",
                        ErrorClassifier.classify(event.getLastThrowable()).map(Enum::name).orElse("UNCLASSIFIED")));

        Supplier<CompletionStage<T>> guarded = () -> attempt(operation, policy);
        Retry.decorateCompletionStage(retry, scheduler, guarded).get()
                .whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(ErrorClassifier.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                });
        return result;
    }

    /**
     * Runs every operation concurrently, each with its own retry loop.
     * One failure never cancels the others.
     *
     * @return outcomes in the same order as {@code operations}
     */
    public <T> CompletableFuture<List<BatchOutcome<T>>> retryBatch(
            List<Supplier<CompletableFuture<T>>> operations,
            RetryPolicy policy
    ) {
        List<CompletableFuture<BatchOutcome<T>>> settled = operations.stream()
                .map(operation -> retryWithBackoff(operation, policy)
                        .handle((value, error) -> error == null
                                ? BatchOutcome.success(value)
                                : BatchOutcome.<T>failure(ErrorClassifier.unwrap(error))))
                .toList();

        return CompletableFuture.allOf(settled.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> settled.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private RetryConfig retryConfig(RetryPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalFunction(backoffCalculator.intervalFunction(policy))
                .retryOnException(error -> !closed && shouldRetry(ErrorClassifier.classify(error), policy))
                .build();
    }

    private <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        if (closed) {
            return CompletableFuture.failedFuture(closedError());
        }
        try {
            CompletableFuture<T> call = operation.get();
            if (call == null) {
                return CompletableFuture.failedFuture(new NullPointerException("Operation returned no future"));
            }
            if (policy.getTimeout() != null) {
                call = timeoutGuard.withTimeout(call, policy.getTimeout());
            }
            return call;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onRetry(RetryOnRetryEvent event, RetryPolicy policy, CompletableFuture<?> result) {
        Throwable cause = ErrorClassifier.unwrap(event.getLastThrowable());
        Optional<ErrorKind> kind = ErrorClassifier.classify(cause);
        notifyListener(new RetryAttempt(
                event.getNumberOfRetryAttempts(),
                policy.getMaxAttempts(),
                kind.orElse(ErrorKind.EXTERNAL_API_FAILURE),
                event.getWaitInterval(),
                cause));

        // The backoff is about to be scheduled; a stopped scheduler would drop it
        if (scheduler.isShutdown()) {
            result.completeExceptionally(closedError());
        }
    }

    private static boolean shouldRetry(Optional<ErrorKind> kind, RetryPolicy policy) {
        return kind.isPresent() && !kind.get().isFatal() && policy.isRetryable(kind.get());
    }

    private void notifyListener(RetryAttempt attempt) {
        try {
            listener.onRetry(attempt);
        } catch (RuntimeException e) {
            log.error("Retry listener failed: attempt={}", attempt.attempt(), e);
        }
    }

    private static GatewayException closedError() {
        return new GatewayException(ErrorKind.SERVICE_UNAVAILABLE, "Retry executor is closed");
    }

    /**
     * Number of retry loops that have not settled yet.
     */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        closed = true;
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        for (CompletableFuture<?> result : List.copyOf(pending)) {
            if (result.completeExceptionally(closedError())) {
                log.debug("Pending retry failed on close");
            }
        }
    }
}
