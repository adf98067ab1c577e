/**
 * Provider capability contract, registry and factory.
 *
 * <h2>Adding a Provider</h2>
 * <ol>
 *   <li>Implement {@link fr.lapetina.ai.gateway.domain.provider.ChatProvider}, usually by extending
 *       {@link fr.lapetina.ai.gateway.domain.provider.AbstractChatProvider}</li>
 *   <li>Register a {@link fr.lapetina.ai.gateway.domain.provider.ProviderConstructor} under its name
 *       in the {@link fr.lapetina.ai.gateway.domain.provider.ProviderRegistry} at start-up</li>
 * </ol>
 *
 * <p>The {@link fr.lapetina.ai.gateway.domain.provider.ProviderFactory} resolves constructors by the
 * configuration's {@code provider} tag.
 */
package fr.lapetina.ai.gateway.domain.provider;
