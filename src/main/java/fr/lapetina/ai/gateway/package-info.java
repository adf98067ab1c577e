/**
 * AI Provider Gateway - resilient access to interchangeable chat completion backends.
 *
 * <p>Callers talk to one {@link fr.lapetina.ai.gateway.domain.provider.ChatProvider} interface;
 * the backend (OpenAI or an Azure OpenAI deployment) is chosen by configuration. Every outbound
 * call is protected by retry with exponential backoff, a circuit breaker and, optionally, a
 * rate-limited serial queue.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ai.gateway.ProviderGateway} - Main entry point for creating
 *       a fully-configured provider from YAML or environment variables</li>
 *   <li>{@link fr.lapetina.ai.gateway.ProviderGatewayApplication} - Start-up configuration check</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ProviderGateway gateway = ProviderGateway.fromEnvironment(System.getenv())) {
 *     ChatCompletionRequest request = ChatCompletionRequest.ofPrompt("gpt-4o", "Hello!");
 *     ChatCompletionResponse response = gateway.chat(request).join();
 *     System.out.println(response.firstContent());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Name-keyed provider registry populated at start-up</li>
 *   <li>Retry, circuit breaker, timeout and rate-limited queue primitives</li>
 *   <li>Detection of legacy configuration with migration guidance</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.ai.gateway.ProviderGateway
 * @see fr.lapetina.ai.gateway.infrastructure.resilience.ProviderResilience
 */
package fr.lapetina.ai.gateway;
