package fr.lapetina.ai.gateway.domain.model;

import java.util.Objects;

/**
 * Classified failure raised by providers, resilience primitives and the configuration validator.
 *
 * The {@link ErrorKind} is what retry and circuit breaker policies match against.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final String provider;
    private final Integer statusCode;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public GatewayException(ErrorKind kind, String message, String provider, Integer statusCode) {
        this(kind, message, provider, statusCode, null);
    }

    public GatewayException(
            ErrorKind kind,
            String message,
            String provider,
            Integer statusCode,
            Throwable cause
    ) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Name of the provider that raised the error, or null for provider-independent errors.
     */
    public String getProvider() {
        return provider;
    }

    /**
     * HTTP status returned by the backend, when there was one.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "GatewayException{" +
                "kind=" + kind +
                (provider != null ? ", provider='" + provider + '\'' : "") +
                (statusCode != null ? ", status=" + statusCode : "") +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
