package fr.lapetina.ai.gateway.domain.provider;

import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ModelCapabilities;
import fr.lapetina.ai.gateway.domain.model.UsageInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Capability contract every AI backend adapter implements.
 *
 * Implementations must fail with {@link fr.lapetina.ai.gateway.domain.model.GatewayException}
 * so that retry and circuit breaker policies can classify errors.
 */
public interface ChatProvider {

    /**
     * Registry name of this provider (e.g. "openai").
     */
    String name();

    List<String> supportedModels();

    boolean supportsStreaming();

    boolean supportsReasoning();

    /**
     * Sends a chat completion request.
     *
     * @param request validated against {@link ChatRequestValidator} before anything is sent
     * @return future completed with the backend's answer
     */
    CompletableFuture<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request);

    /**
     * Sends a streaming chat completion request.
     *
     * <p>The returned stream is lazy, finite and single-use: it ends when the backend signals
     * completion and must be closed by the caller (try-with-resources). Reading the answer again
     * requires a new call.
     */
    Stream<ChatCompletionChunk> createStreamingChatCompletion(ChatCompletionRequest request);

    /**
     * Checks the configured credentials against the backend.
     *
     * @return future completed with false when the backend rejects the configuration
     */
    CompletableFuture<Boolean> validateConfiguration();

    CompletableFuture<UsageInfo> getUsageInfo();

    default boolean isModelSupported(String model) {
        return model != null && supportedModels().contains(model);
    }

    ModelCapabilities getModelCapabilities(String model);
}
