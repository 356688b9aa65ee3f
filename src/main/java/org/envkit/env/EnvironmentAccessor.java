package org.envkit.env;

import java.util.Optional;

/**
 * A narrow view of an environment variable store. The parser and the binder never
 * touch the process environment directly; they go through this interface, which keeps
 * them testable without a real environment.
 */
public interface EnvironmentAccessor {

    /**
     * Looks up a variable.
     * @param key The variable name.
     * @return The value, or empty if the variable is not set.
     */
    Optional<String> get(String key);

    /**
     * Sets a variable.
     * @param key The variable name.
     * @param value The value.
     * @throws IllegalArgumentException if the name is empty or contains {@code '='} or NUL.
     */
    void set(String key, String value);

    /**
     * Removes a variable. Removing an unset variable is not an error.
     * @param key The variable name.
     */
    void unset(String key);

    /**
     * @param key The variable name.
     * @return Whether the variable is set.
     */
    default boolean has(String key) {
        return get(key).isPresent();
    }

    /**
     * Rejects names that no process environment can hold.
     * @param key The variable name to check.
     * @throws IllegalArgumentException if the name is null, empty, or contains {@code '='} or NUL.
     */
    static void requireValidName(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Environment variable name must not be empty");
        }
        if (key.indexOf('=') >= 0 || key.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid environment variable name: " + key);
        }
    }
}
