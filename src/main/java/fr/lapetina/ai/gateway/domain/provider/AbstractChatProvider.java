package fr.lapetina.ai.gateway.domain.provider;

import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ErrorKind;
import fr.lapetina.ai.gateway.domain.model.GatewayException;
import fr.lapetina.ai.gateway.domain.model.ModelCapabilities;

/**
 * Base class for providers: default capabilities, shared request validation and error creation.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    /**
     * Default capabilities; providers with model-specific limits override this.
     */
    @Override
    public ModelCapabilities getModelCapabilities(String model) {
        return ModelCapabilities.defaults(supportsStreaming());
    }

    /**
     * @throws GatewayException with INVALID_REQUEST or UNSUPPORTED_MODEL
     */
    protected void validateRequest(ChatCompletionRequest request) {
        ChatRequestValidator.validate(request, this);
    }

    protected GatewayException createError(ErrorKind kind, String message, Integer statusCode) {
        return new GatewayException(kind, message, name(), statusCode);
    }

    protected GatewayException createError(ErrorKind kind, String message, Integer statusCode, Throwable cause) {
        return new GatewayException(kind, message, name(), statusCode, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name() + "'}";
    }
}
