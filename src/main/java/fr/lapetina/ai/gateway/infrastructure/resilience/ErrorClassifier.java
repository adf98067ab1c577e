package fr.lapetina.ai.gateway.infrastructure.resilience;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures onto the {@link ErrorKind} taxonomy.
 *
 * Only {@link GatewayException} and a small set of JDK I/O exceptions are classified;
 * anything else is reported as unclassified and is never retried.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a failure.
     *
     * @return the kind, or empty if the failure is not one the gateway knows about
     */
    public static Optional<ErrorKind> classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof GatewayException gatewayException) {
            return Optional.of(gatewayException.getKind());
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return Optional.of(ErrorKind.TIMEOUT);
        }
        if (cause instanceof ConnectException || cause instanceof IOException) {
            return Optional.of(ErrorKind.NETWORK_FAILURE);
        }
        return Optional.empty();
    }

    /**
     * Strips the wrappers added by {@code CompletableFuture}.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
