package org.envkit.env;

/**
 * Thrown when a variable of a parsed mapping cannot be set in the target environment.
 * Variables set before the failing one stay set.
 */
public class ApplyException extends Exception {

    private final String key;

    /**
     * @param key The name of the variable that could not be set.
     * @param cause The underlying failure.
     */
    public ApplyException(String key, Throwable cause) {
        super("Failed to set environment variable " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    /**
     * @return The name of the variable that could not be set.
     */
    public String getKey() {
        return key;
    }
}
