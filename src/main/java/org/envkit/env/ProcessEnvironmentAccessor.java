package org.envkit.env;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An {@link EnvironmentAccessor} over the environment of the running JVM.
 * <p>
 * The JVM cannot change its own environment, so {@link #set} and {@link #unset} are
 * kept in an in-process overlay that lookups consult before {@link System#getenv()}.
 * {@link #snapshot()} returns the effective environment, e.g. to start child processes with it.
 */
public class ProcessEnvironmentAccessor implements EnvironmentAccessor {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessEnvironmentAccessor.class);
    private static final ProcessEnvironmentAccessor SHARED = new ProcessEnvironmentAccessor(System.getenv());

    private final Map<String, String> base;
    private final Map<String, Optional<String>> overlay = new ConcurrentHashMap<>();

    /**
     * @param base The underlying environment, normally {@link System#getenv()}.
     */
    public ProcessEnvironmentAccessor(Map<String, String> base) {
        this.base = base;
    }

    /**
     * @return The accessor shared by the whole JVM.
     */
    public static ProcessEnvironmentAccessor shared() {
        return SHARED;
    }

    @Override
    public Optional<String> get(String key) {
        Optional<String> overridden = overlay.get(key);
        if (overridden != null) {
            return overridden;
        }
        return Optional.ofNullable(base.get(key));
    }

    @Override
    public void set(String key, String value) {
        EnvironmentAccessor.requireValidName(key);
        overlay.put(key, Optional.of(value));
        LOG.trace("Set {}", key);
    }

    @Override
    public void unset(String key) {
        overlay.put(key, Optional.empty());
        LOG.trace("Unset {}", key);
    }

    /**
     * @return A copy of the effective environment, overlay applied.
     */
    public Map<String, String> snapshot() {
        Map<String, String> effective = new HashMap<>(base);
        overlay.forEach((key, value) -> {
            if (value.isPresent()) {
                effective.put(key, value.get());
            } else {
                effective.remove(key);
            }
        });
        return effective;
    }
}
