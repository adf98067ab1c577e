package fr.lapetina.ai.gateway.infrastructure.config;

import fr.lapetina.ai.gateway.infrastructure.config.MigrationGuidance.MigrationStep;
import fr.lapetina.ai.gateway.infrastructure.config.MigrationGuidance.Resource;

import java.util.List;

/**
 * Catalogue of remediation texts for legacy and incomplete configurations.
 */
public final class MigrationGuides {

    private static final Resource API_KEYS = new Resource(
            "Get OpenAI API Key",
            "https://platform.openai.com/api-keys",
            "Create and manage your OpenAI API keys"
    );

    private static final Resource API_DOCS = new Resource(
            "OpenAI API Documentation",
            "https://platform.openai.com/docs/api-reference",
            "Official OpenAI API documentation"
    );

    private static final MigrationStep SET_API_KEY = new MigrationStep(
            "Set OPENAI_API_KEY",
            "Add your official OpenAI API key",
            "OPENAI_API_KEY=sk-..."
    );

    /** Guide for the credential-token family (OPENAI_ACCESS_TOKEN, CHATGPT_ACCESS_TOKEN). */
    public static final MigrationGuidance ACCESS_TOKEN = new MigrationGuidance(
            "Deprecated Configuration Detected",
            "The OPENAI_ACCESS_TOKEN variable is no longer supported. Please migrate to the official OpenAI API.",
            List.of(
                    new MigrationStep("Remove OPENAI_ACCESS_TOKEN",
                            "Delete the OPENAI_ACCESS_TOKEN environment variable"),
                    SET_API_KEY,
                    new MigrationStep("Remove API_REVERSE_PROXY",
                            "Delete the API_REVERSE_PROXY environment variable if present")
            ),
            List.of(API_KEYS)
    );

    /** Guide for the reverse-proxy family (API_REVERSE_PROXY, REVERSE_PROXY_URL). */
    public static final MigrationGuidance REVERSE_PROXY = new MigrationGuidance(
            "Deprecated Reverse Proxy Configuration Detected",
            "The API_REVERSE_PROXY variable is no longer supported. Please migrate to the official OpenAI API.",
            List.of(
                    new MigrationStep("Remove API_REVERSE_PROXY",
                            "Delete the API_REVERSE_PROXY environment variable"),
                    SET_API_KEY,
                    new MigrationStep("Optional: Set OPENAI_API_BASE_URL",
                            "Set custom API base URL if needed",
                            "OPENAI_API_BASE_URL=https://api.openai.com")
            ),
            List.of(API_KEYS, API_DOCS)
    );

    static final String MISSING_OPENAI = """
            Missing Required Configuration: OPENAI_API_KEY

            The application requires a valid OpenAI API key to function.

            Setup Steps:
            1. Get your API key from: https://platform.openai.com/api-keys
            2. Set the environment variable: OPENAI_API_KEY=sk-your-api-key-here
            3. Optionally set: OPENAI_API_BASE_URL=https://api.openai.com (if using a custom endpoint)

            Example configuration:
            OPENAI_API_KEY=sk-proj-...
            OPENAI_API_MODEL=gpt-4o
            OPENAI_API_BASE_URL=https://api.openai.com

            Please set your API key and restart the application.""";

    static final String MISSING_AZURE = """
            Missing Required Azure OpenAI Configuration

            The application is configured to use Azure OpenAI but required environment variables are missing.

            Required Azure OpenAI Environment Variables:
            - AZURE_OPENAI_API_KEY: Your Azure OpenAI API key
            - AZURE_OPENAI_ENDPOINT: Your Azure OpenAI endpoint (e.g., https://your-resource.openai.azure.com)
            - AZURE_OPENAI_DEPLOYMENT: Your Azure OpenAI deployment name
            - AZURE_OPENAI_API_VERSION: API version (optional, defaults to 2024-02-15-preview)

            Setup Steps:
            1. Get your Azure OpenAI credentials from the Azure Portal
            2. Set the required environment variables
            3. Restart the application

            Example configuration:
            AI_PROVIDER=azure
            AZURE_OPENAI_API_KEY=your_azure_api_key_here
            AZURE_OPENAI_ENDPOINT=https://your-resource.openai.azure.com
            AZURE_OPENAI_DEPLOYMENT=your_deployment_name
            AZURE_OPENAI_API_VERSION=2024-02-15-preview

            Please set your Azure OpenAI configuration and restart the application.""";

    private MigrationGuides() {
        // Utility class
    }

    /**
     * Fallback guide listing every offending variable.
     */
    public static MigrationGuidance generic(List<String> deprecatedVariables) {
        return new MigrationGuidance(
                "Deprecated Configuration Detected",
                "The following configuration variables are no longer supported.",
                List.of(
                        new MigrationStep("Remove deprecated variables: " + String.join(", ", deprecatedVariables),
                                "Delete the deprecated environment variables"),
                        SET_API_KEY
                ),
                List.of(API_KEYS)
        );
    }

    /**
     * Picks the guide for the deprecated variables found: credential tokens first,
     * then reverse proxies, then the generic guide.
     */
    public static MigrationGuidance forDeprecated(List<String> deprecatedVariables) {
        if (deprecatedVariables.contains(EnvironmentVariables.OPENAI_ACCESS_TOKEN)
                || deprecatedVariables.contains(EnvironmentVariables.CHATGPT_ACCESS_TOKEN)) {
            return ACCESS_TOKEN;
        }
        if (deprecatedVariables.contains(EnvironmentVariables.API_REVERSE_PROXY)
                || deprecatedVariables.contains(EnvironmentVariables.REVERSE_PROXY_URL)) {
            return REVERSE_PROXY;
        }
        return generic(deprecatedVariables);
    }

    /**
     * Setup guide for a provider mode whose required variables are missing.
     */
    public static String missingConfiguration(String providerMode) {
        return ProviderConfig.AZURE.equals(providerMode) ? MISSING_AZURE : MISSING_OPENAI;
    }
}
