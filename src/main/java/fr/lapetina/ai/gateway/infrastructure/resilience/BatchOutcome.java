package fr.lapetina.ai.gateway.infrastructure.resilience;

/**
 * Settled result of one operation in a batch: either a value or a failure.
 */
public record BatchOutcome<T>(T value, Throwable failure) {

    public static <T> BatchOutcome<T> success(T value) {
        return new BatchOutcome<>(value, null);
    }

    public static <T> BatchOutcome<T> failure(Throwable failure) {
        return new BatchOutcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
