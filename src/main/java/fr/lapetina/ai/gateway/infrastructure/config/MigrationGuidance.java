package fr.lapetina.ai.gateway.infrastructure.config;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Remediation text for a legacy configuration: title, description, ordered steps and links.
 */
public record MigrationGuidance(
        String title,
        String description,
        List<MigrationStep> steps,
        List<Resource> resources
) {

    public MigrationGuidance {
        steps = List.copyOf(steps);
        resources = List.copyOf(resources);
    }

    /**
     * One migration action, with an optional example line.
     */
    public record MigrationStep(String action, String description, String example) {

        public MigrationStep(String action, String description) {
            this(action, description, null);
        }
    }

    public record Resource(String title, String url, String description) {
    }

    /**
     * Renders the guidance as the multi-line message shown to the operator.
     *
     * @param deprecatedVariables variables found in the environment
     */
    public String format(List<String> deprecatedVariables) {
        String numberedSteps = IntStream.range(0, steps.size())
                .mapToObj(i -> formatStep(i + 1, steps.get(i)))
                .collect(Collectors.joining("\n\n"));

        String links = resources.stream()
                .map(r -> "• " + r.title() + ": " + r.url() + "\n  " + r.description())
                .collect(Collectors.joining("\n"));

        return title + "\n\n"
                + description + "\n\n"
                + "Deprecated variables found: " + String.join(", ", deprecatedVariables) + "\n\n"
                + "Migration Steps:\n" + numberedSteps + "\n\n"
                + "Resources:\n" + links + "\n\n"
                + "Please update your configuration and restart the application.";
    }

    private static String formatStep(int number, MigrationStep step) {
        StringBuilder sb = new StringBuilder()
                .append(number).append(". ").append(step.action())
                .append("\n   ").append(step.description());
        if (step.example() != null) {
            sb.append("\n   Example: ").append(step.example());
        }
        return sb.toString();
    }
}
