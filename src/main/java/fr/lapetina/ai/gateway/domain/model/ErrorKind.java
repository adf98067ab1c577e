package fr.lapetina.ai.gateway.domain.model;

/**
 * Error taxonomy for provider calls and configuration.
 * Every failure raised by adapters or resilience code carries exactly one kind.
 */
public enum ErrorKind {
    /** Request shape violation (empty messages, temperature out of range, ...) */
    INVALID_REQUEST(false, false),

    /** Requested model is not offered by the provider */
    UNSUPPORTED_MODEL(false, false),

    /** Required configuration is absent */
    CONFIGURATION_MISSING(false, true),

    /** Legacy configuration that is no longer supported */
    CONFIGURATION_DEPRECATED(false, true),

    /** Credential rejected by the backend (HTTP 401) */
    AUTHENTICATION_FAILURE(false, true),

    /** Credential lacks permissions (HTTP 403) */
    AUTHORIZATION_FAILURE(false, true),

    /** Backend-side rate limit hit (HTTP 429) */
    RATE_LIMITED(true, false),

    /** Call did not complete within its deadline */
    TIMEOUT(true, false),

    /** Connection-level failure */
    NETWORK_FAILURE(true, false),

    /** Backend answered with an error */
    EXTERNAL_API_FAILURE(true, false),

    /** Circuit breaker is open for the dependency */
    SERVICE_UNAVAILABLE(false, false);

    private final boolean transientFailure;
    private final boolean fatal;

    ErrorKind(boolean transientFailure, boolean fatal) {
        this.transientFailure = transientFailure;
        this.fatal = fatal;
    }

    /**
     * Whether the failure may succeed when tried again later.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Whether the failure signals operator error. Fatal kinds are never retried.
     */
    public boolean isFatal() {
        return fatal;
    }
}
