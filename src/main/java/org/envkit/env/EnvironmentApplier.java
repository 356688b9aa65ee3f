package org.envkit.env;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a parsed mapping into an {@link EnvironmentAccessor}.
 */
public class EnvironmentApplier {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentApplier.class);

    private final EnvironmentAccessor target;

    /**
     * @param target The environment to write into.
     */
    public EnvironmentApplier(EnvironmentAccessor target) {
        this.target = target;
    }

    /**
     * Sets every variable of {@code env} in sorted key order. The first failure stops
     * the run; variables already set are not rolled back.
     *
     * @param env The variables to set.
     * @throws ApplyException if a variable cannot be set.
     */
    public void apply(Map<String, String> env) throws ApplyException {
        int applied = 0;
        for (Map.Entry<String, String> entry : new TreeMap<>(env).entrySet()) {
            try {
                target.set(entry.getKey(), entry.getValue());
                applied++;
            } catch (RuntimeException e) {
                LOG.warn("Stopped after {} variables: {} could not be set", applied, entry.getKey());
                throw new ApplyException(entry.getKey(), e);
            }
        }
        LOG.debug("Applied {} variables", applied);
    }
}
