package fr.lapetina.ai.gateway.infrastructure.config;

import java.util.List;

/**
 * Outcome of a non-throwing configuration check.
 *
 * @param valid    true when {@code errors} is empty
 * @param errors   problems that prevent start-up
 * @param warnings problems worth reporting that do not prevent start-up
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
