package fr.lapetina.ai.gateway.domain.provider;

/**
 * Builds a provider instance from configuration.
 *
 * @param <C> configuration type handed to the constructor
 */
@FunctionalInterface
public interface ProviderConstructor<C> {

    ChatProvider create(C config);
}
