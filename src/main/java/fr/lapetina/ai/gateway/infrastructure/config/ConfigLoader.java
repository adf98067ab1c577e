package fr.lapetina.ai.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static fr.lapetina.ai.gateway.infrastructure.config.EnvironmentVariables.*;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading YAML from the file system, falling back to the classpath
 * - Loading YAML from a stream
 * - Building the configuration from environment variables
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ProviderConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public ProviderConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ProviderConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ProviderConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ProviderConfig parse(InputStream is, String source) {
        try {
            ProviderConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the configuration from environment variables.
     *
     * Both provider sections are filled so that switching {@code AI_PROVIDER} is enough to
     * change backends.
     */
    public static ProviderConfig fromEnvironment(Map<String, String> env) {
        ProviderConfig config = createDefault();
        config.setProvider(valueOrDefault(env, AI_PROVIDER, ProviderConfig.OPENAI));
        config.setDefaultModel(valueOrDefault(env, DEFAULT_MODEL, config.getDefaultModel()));
        config.setEnableReasoning("true".equals(env.get(ENABLE_REASONING)));
        config.setTimeoutMs(parseLong(env.get(TIMEOUT_MS), config.getTimeoutMs()));

        ProviderConfig.OpenAiSettings openai = new ProviderConfig.OpenAiSettings();
        openai.setApiKey(env.getOrDefault(OPENAI_API_KEY, ""));
        openai.setBaseUrl(env.get(OPENAI_API_BASE_URL));
        openai.setOrganization(env.get(OPENAI_ORGANIZATION));
        config.setOpenai(openai);

        ProviderConfig.AzureSettings azure = new ProviderConfig.AzureSettings();
        azure.setApiKey(env.getOrDefault(AZURE_OPENAI_API_KEY, ""));
        azure.setEndpoint(env.getOrDefault(AZURE_OPENAI_ENDPOINT, ""));
        azure.setDeployment(env.getOrDefault(AZURE_OPENAI_DEPLOYMENT, ""));
        azure.setApiVersion(valueOrDefault(env, AZURE_OPENAI_API_VERSION, ProviderConfig.AzureSettings.DEFAULT_API_VERSION));
        config.setAzure(azure);

        log.info("Configuration loaded from environment: provider={}, defaultModel={}",
                config.getProvider(), config.getDefaultModel());
        return config;
    }

    public static ProviderConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    // Empty values count as unset
    private static String valueOrDefault(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid numeric value for " + TIMEOUT_MS + ": " + value, e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ProviderConfig createDefault() {
        return new ProviderConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
