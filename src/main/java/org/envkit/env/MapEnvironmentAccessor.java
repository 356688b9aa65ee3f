package org.envkit.env;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An {@link EnvironmentAccessor} backed by an in-memory map. Used for embedding
 * and for environment-free tests.
 */
public class MapEnvironmentAccessor implements EnvironmentAccessor {

    private final Map<String, String> variables = new ConcurrentHashMap<>();

    public MapEnvironmentAccessor() {
    }

    /**
     * @param initial Variables to start with.
     */
    public MapEnvironmentAccessor(Map<String, String> initial) {
        variables.putAll(initial);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    @Override
    public void set(String key, String value) {
        EnvironmentAccessor.requireValidName(key);
        variables.put(key, value);
    }

    @Override
    public void unset(String key) {
        variables.remove(key);
    }

    /**
     * @return An unmodifiable view of the current variables.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(variables);
    }
}
