package fr.lapetina.ai.gateway.infrastructure.config;

import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static fr.lapetina.ai.gateway.infrastructure.config.EnvironmentVariables.*;

/**
 * Start-up check of the environment.
 *
 * Detects legacy variables that are no longer supported and verifies that the variables
 * required by the selected provider mode ({@code AI_PROVIDER}, default {@code openai}) are set.
 * Failures carry the full remediation text as their message.
 */
public final class ConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

    private static final String HTTPS = "https://";

    private final Map<String, String> environment;

    /**
     * @param environment variable lookup, usually {@link System#getenv()}
     */
    public ConfigurationValidator(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    public ConfigurationValidator() {
        this(System.getenv());
    }

    /**
     * Validates the environment.
     *
     * @throws GatewayException CONFIGURATION_DEPRECATED when a legacy variable is set, with the
     *                          migration guide as message; CONFIGURATION_MISSING when a required
     *                          variable of the selected mode is absent, with the setup guide
     */
    public void validateEnvironment() {
        List<String> deprecated = getDeprecatedVariables();
        if (!deprecated.isEmpty()) {
            log.error("Deprecated configuration detected: variables={}", deprecated);
            throw new GatewayException(
                    ErrorKind.CONFIGURATION_DEPRECATED,
                    MigrationGuides.forDeprecated(deprecated).format(deprecated)
            );
        }

        String mode = providerMode();
        List<String> missing = missingRequired(mode);
        if (!missing.isEmpty()) {
            log.error("Missing required configuration: mode={}, variables={}", mode, missing);
            throw new GatewayException(ErrorKind.CONFIGURATION_MISSING, MigrationGuides.missingConfiguration(mode));
        }

        log.info("Environment configuration valid: mode={}", mode);
    }

    /**
     * Validates the environment, then returns the values the application runs with.
     *
     * @throws GatewayException as {@link #validateEnvironment()}
     */
    public ValidatedConfig getValidatedConfig() {
        validateEnvironment();

        boolean azure = ProviderConfig.AZURE.equals(providerMode());
        return new ValidatedConfig(
                azure ? get(AZURE_OPENAI_API_KEY) : get(OPENAI_API_KEY),
                azure ? get(AZURE_OPENAI_ENDPOINT) : get(OPENAI_API_BASE_URL),
                isEmpty(get(OPENAI_API_MODEL)) ? ValidatedConfig.DEFAULT_MODEL : get(OPENAI_API_MODEL),
                parseTimeout(get(TIMEOUT_MS)),
                "true".equals(get(OPENAI_API_DISABLE_DEBUG))
        );
    }

    /**
     * Returns the deprecated variables that are set to a non-empty value, in declaration order.
     */
    public List<String> getDeprecatedVariables() {
        return EnvironmentVariables.DEPRECATED.stream()
                .filter(name -> !isEmpty(get(name)))
                .toList();
    }

    /**
     * Describes what must change to reach a supported configuration. Recomputed on each call.
     */
    public MigrationInfo getMigrationInfo() {
        List<String> deprecated = getDeprecatedVariables();
        List<String> steps = new ArrayList<>();

        if (!deprecated.isEmpty()) {
            steps.add("Remove deprecated variables: " + String.join(", ", deprecated));
        }

        String mode = providerMode();
        for (String variable : missingRequired(mode)) {
            steps.add(setupStep(variable));
        }
        steps.add("Restart the application");

        return new MigrationInfo(!deprecated.isEmpty(), deprecated, steps);
    }

    /**
     * Runs the same checks as {@link #validateEnvironment()} without throwing.
     */
    public ValidationResult validateSafely() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<String> deprecated = getDeprecatedVariables();
        if (!deprecated.isEmpty()) {
            errors.add("Deprecated configuration detected: " + String.join(", ", deprecated));
        }

        String mode = providerMode();
        for (String variable : missingRequired(mode)) {
            errors.add("Missing required configuration: " + variable);
        }

        String urlVariable = ProviderConfig.AZURE.equals(mode) ? AZURE_OPENAI_ENDPOINT : OPENAI_API_BASE_URL;
        String url = get(urlVariable);
        if (!isEmpty(url) && !url.startsWith(HTTPS)) {
            warnings.add(urlVariable + " should use HTTPS protocol");
        }

        return ValidationResult.of(errors, warnings);
    }

    private List<String> missingRequired(String mode) {
        List<String> missing = new ArrayList<>();
        if (ProviderConfig.AZURE.equals(mode)) {
            for (String name : List.of(AZURE_OPENAI_API_KEY, AZURE_OPENAI_ENDPOINT, AZURE_OPENAI_DEPLOYMENT)) {
                if (isEmpty(get(name))) {
                    missing.add(name);
                }
            }
        } else {
            String apiKey = get(OPENAI_API_KEY);
            if (apiKey == null || apiKey.isBlank()) {
                missing.add(OPENAI_API_KEY);
            }
        }
        return missing;
    }

    private static String setupStep(String variable) {
        return switch (variable) {
            case AZURE_OPENAI_API_KEY -> "Set AZURE_OPENAI_API_KEY with your Azure OpenAI API key";
            case AZURE_OPENAI_ENDPOINT -> "Set AZURE_OPENAI_ENDPOINT with your Azure OpenAI endpoint";
            case AZURE_OPENAI_DEPLOYMENT -> "Set AZURE_OPENAI_DEPLOYMENT with your Azure OpenAI deployment name";
            default -> "Set " + variable + " with your official OpenAI API key";
        };
    }

    private String providerMode() {
        String mode = get(AI_PROVIDER);
        return isEmpty(mode) ? ProviderConfig.OPENAI : mode;
    }

    /**
     * Unparseable or zero values fall back to the default.
     */
    static long parseTimeout(String value) {
        if (isEmpty(value)) {
            return ValidatedConfig.DEFAULT_TIMEOUT_MS;
        }
        try {
            long timeout = Long.parseLong(value.trim());
            return timeout != 0 ? timeout : ValidatedConfig.DEFAULT_TIMEOUT_MS;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value, using default: value={}", TIMEOUT_MS, value);
            return ValidatedConfig.DEFAULT_TIMEOUT_MS;
        }
    }

    private String get(String name) {
        return environment.get(name);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
