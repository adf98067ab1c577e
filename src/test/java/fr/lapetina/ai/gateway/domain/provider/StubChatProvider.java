package fr.lapetina.ai.gateway.domain.provider;

import fr.lapetina.ai.gateway.domain.model.ChatCompletionChunk;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionRequest;
import fr.lapetina.ai.gateway.domain.model.ChatCompletionResponse;
import fr.lapetina.ai.gateway.domain.model.ChatMessage;
import fr.lapetina.ai.gateway.domain.model.UsageInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * In-memory provider for tests: echoes the last user message and answers
 * {@link #validateConfiguration()} from a configurable supplier.
 */
class StubChatProvider extends AbstractChatProvider {

    private final String name;
    private final List<String> models;
    private final Supplier<CompletableFuture<Boolean>> validation;

    StubChatProvider(String name, List<String> models, Supplier<CompletableFuture<Boolean>> validation) {
        this.name = name;
        this.models = models;
        this.validation = validation;
    }

    StubChatProvider(String name) {
        this(name, List.of("gpt-4o", "gpt-3.5-turbo"), () -> CompletableFuture.completedFuture(true));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> supportedModels() {
        return models;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean supportsReasoning() {
        return false;
    }

    @Override
    public CompletableFuture<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request) {
        try {
            validateRequest(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        String last = request.messages().get(request.messages().size() - 1).content();
        return CompletableFuture.completedFuture(new ChatCompletionResponse(
                "stub-1",
                "chat.completion",
                0,
                request.model(),
                List.of(new ChatCompletionResponse.Choice(0, ChatMessage.assistant(last), "stop")),
                UsageInfo.of(1, 1)
        ));
    }

    @Override
    public Stream<ChatCompletionChunk> createStreamingChatCompletion(ChatCompletionRequest request) {
        validateRequest(request);
        return Stream.empty();
    }

    @Override
    public CompletableFuture<Boolean> validateConfiguration() {
        return validation.get();
    }

    @Override
    public CompletableFuture<UsageInfo> getUsageInfo() {
        return CompletableFuture.completedFuture(UsageInfo.empty());
    }
}
