package fr.lapetina.ai.gateway.domain.provider;

import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatMessage;
import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;

/**
 * Request checks shared by all providers.
 *
 * Validates:
 * - Messages are present, each with a role and content
 * - Model name is present and supported by the provider
 * - Temperature, when given, is within [0, 2]
 * - Max tokens, when given, is positive
 *
 * Violations are INVALID_REQUEST or UNSUPPORTED_MODEL and are never retried.
 */
public final class ChatRequestValidator {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private ChatRequestValidator() {
        // Utility class
    }

    /**
     * @throws GatewayException if the request is not acceptable for {@code provider}
     */
    public static void validate(ChatCompletionRequest request, ChatProvider provider) {
        String providerName = provider.name();

        if (request == null) {
            throw invalid("Request is required", providerName);
        }

        if (request.messages().isEmpty()) {
            throw invalid("Messages array cannot be empty", providerName);
        }

        for (ChatMessage message : request.messages()) {
            if (message == null || message.role() == null) {
                throw invalid("Message role is required", providerName);
            }
            if (message.content() == null) {
                throw invalid("Message content is required", providerName);
            }
        }

        String model = request.model();
        if (model == null || model.isBlank()) {
            throw invalid("Model is required", providerName);
        }

        if (!provider.isModelSupported(model)) {
            throw new GatewayException(
                    ErrorKind.UNSUPPORTED_MODEL,
                    "Model " + model + " is not supported by " + providerName,
                    providerName,
                    null
            );
        }

        Double temperature = request.temperature();
        if (temperature != null && (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            throw invalid("Temperature must be between 0 and 2", providerName);
        }

        Integer maxTokens = request.maxTokens();
        if (maxTokens != null && maxTokens <= 0) {
            throw invalid("Max tokens must be greater than 0", providerName);
        }
    }

    private static GatewayException invalid(String message, String providerName) {
        return new GatewayException(ErrorKind.INVALID_REQUEST, message, providerName, null);
    }
}
