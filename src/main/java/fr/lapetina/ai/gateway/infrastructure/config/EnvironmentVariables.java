package fr.lapetina.ai.gateway.infrastructure.config;

import java.util.List;

/**
 * Names of the environment variables read by {@link ConfigLoader} and {@link ConfigurationValidator}.
 */
public final class EnvironmentVariables {

    public static final String AI_PROVIDER = "AI_PROVIDER";
    public static final String DEFAULT_MODEL = "DEFAULT_MODEL";
    public static final String ENABLE_REASONING = "ENABLE_REASONING";
    public static final String TIMEOUT_MS = "TIMEOUT_MS";

    public static final String OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String OPENAI_API_BASE_URL = "OPENAI_API_BASE_URL";
    public static final String OPENAI_API_MODEL = "OPENAI_API_MODEL";
    public static final String OPENAI_ORGANIZATION = "OPENAI_ORGANIZATION";
    public static final String OPENAI_API_DISABLE_DEBUG = "OPENAI_API_DISABLE_DEBUG";

    public static final String AZURE_OPENAI_API_KEY = "AZURE_OPENAI_API_KEY";
    public static final String AZURE_OPENAI_ENDPOINT = "AZURE_OPENAI_ENDPOINT";
    public static final String AZURE_OPENAI_DEPLOYMENT = "AZURE_OPENAI_DEPLOYMENT";
    public static final String AZURE_OPENAI_API_VERSION = "AZURE_OPENAI_API_VERSION";

    // Legacy credential-token family
    public static final String OPENAI_ACCESS_TOKEN = "OPENAI_ACCESS_TOKEN";
    public static final String CHATGPT_ACCESS_TOKEN = "CHATGPT_ACCESS_TOKEN";

    // Legacy reverse-proxy family
    public static final String API_REVERSE_PROXY = "API_REVERSE_PROXY";
    public static final String REVERSE_PROXY_URL = "REVERSE_PROXY_URL";

    /**
     * Variables that are no longer supported, in reporting order.
     */
    public static final List<String> DEPRECATED = List.of(
            OPENAI_ACCESS_TOKEN,
            API_REVERSE_PROXY,
            CHATGPT_ACCESS_TOKEN,
            REVERSE_PROXY_URL
    );

    private EnvironmentVariables() {
        // Constants
    }
}
