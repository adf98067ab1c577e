package fr.lapetina.ai.gateway;

import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.domain.provider.ChatProvider;
import fr.lapetina.ai.gateway.infrastructure.config.ConfigurationValidator;
import fr.lapetina.ai.gateway.infrastructure.config.MigrationInfo;
import fr.lapetina.ai.gateway.infrastructure.resilience.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Start-up check for the AI Provider Gateway.
 *
 * Validates the configuration (a YAML file when a path is given, the environment otherwise),
 * creates the configured provider and checks its credentials against the backend.
 * Exits with status 1 and the remediation text when anything is wrong.
 */
public class ProviderGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(ProviderGatewayApplication.class);

    private final Map<String, String> environment;

    public ProviderGatewayApplication(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Runs the check.
     *
     * @param configPath YAML configuration, or null to configure from the environment
     * @return name of the validated provider
     * @throws GatewayException when the configuration is rejected or the backend refuses it
     */
    public String run(String configPath) {
        ConfigurationValidator validator = new ConfigurationValidator(environment);
        MigrationInfo migration = validator.getMigrationInfo();
        if (migration.hasDeprecatedConfig()) {
            log.warn("Migration required: steps={}", migration.migrationSteps());
        }

        try (ProviderGateway gateway = configPath != null
                ? ProviderGateway.create(configPath)
                : ProviderGateway.fromEnvironment(environment)) {

            ChatProvider provider = gateway.connect().join();
            log.info("Provider ready: name={}, streaming={}, reasoning={}, models={}",
                    provider.name(), provider.supportsStreaming(), provider.supportsReasoning(),
                    provider.supportedModels().size());
            return provider.name();
        } catch (CompletionException e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (cause instanceof GatewayException gatewayException) {
                throw gatewayException;
            }
            throw e;
        }
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : null;

        try {
            new ProviderGatewayApplication(System.getenv()).run(configPath);
        } catch (GatewayException e) {
            log.error("Start-up check failed: kind={}\n{}", e.getKind(), e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Start-up check failed", e);
            System.exit(1);
        }
    }
}
