package fr.lapetina.ai.gateway.domain.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of provider constructors.
 *
 * One instance is created at start-up and handed to the {@link ProviderFactory};
 * entries are constructors, never provider instances.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderConstructor<?>> constructors = new ConcurrentHashMap<>();

    /**
     * Registers a constructor, replacing any previous entry with the same name.
     *
     * @param name provider name (used as the {@code provider} tag in configuration)
     * @param constructor builds the provider from its settings
     */
    public <C> void register(String name, ProviderConstructor<C> constructor) {
        ProviderConstructor<?> previous = constructors.put(name, constructor);
        if (previous == null) {
            log.info("Provider registered: name={}", name);
        } else {
            log.info("Provider replaced: name={}", name);
        }
    }

    /**
     * Gets the constructor registered under {@code name}.
     *
     * <p>The settings type is not checked; callers pass the settings type they registered.
     */
    @SuppressWarnings("unchecked")
    public <C> Optional<ProviderConstructor<C>> get(String name) {
        return Optional.ofNullable((ProviderConstructor<C>) constructors.get(name));
    }

    public boolean isRegistered(String name) {
        return constructors.containsKey(name);
    }

    /**
     * Returns all registered provider names, sorted.
     */
    public List<String> list() {
        List<String> names = new ArrayList<>(constructors.keySet());
        names.sort(String::compareTo);
        return names;
    }

    /**
     * Removes all entries. For testing/admin use.
     */
    public void clear() {
        constructors.clear();
        log.info("Provider registry cleared");
    }

    public int size() {
        return constructors.size();
    }
}
