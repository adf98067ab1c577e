package fr.lapetina.ai.gateway.infrastructure.config;

import java.util.List;

/**
 * Report on legacy configuration and the steps needed to reach a supported setup.
 */
public record MigrationInfo(
        boolean hasDeprecatedConfig,
        List<String> deprecatedVariables,
        List<String> migrationSteps
) {

    public MigrationInfo {
        deprecatedVariables = List.copyOf(deprecatedVariables);
        migrationSteps = List.copyOf(migrationSteps);
    }
}
