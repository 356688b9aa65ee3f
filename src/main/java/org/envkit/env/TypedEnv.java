package org.envkit.env;

import org.envkit.binding.ConversionException;
import org.envkit.binding.Converter;
import org.envkit.binding.Converters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Typed read access to an {@link EnvironmentAccessor}.
 * <p>
 * Every type has two accessors: {@code getX(key)} returns an empty result when the
 * variable is not set or cannot be converted, and {@code getXOr(key, default)} returns
 * the given default in those cases.
 */
public class TypedEnv {

    private static final Logger LOG = LoggerFactory.getLogger(TypedEnv.class);

    private final EnvironmentAccessor env;

    /**
     * @param env The environment to read from.
     */
    public TypedEnv(EnvironmentAccessor env) {
        this.env = env;
    }

    /**
     * @return A view of the JVM's environment.
     */
    public static TypedEnv system() {
        return new TypedEnv(ProcessEnvironmentAccessor.shared());
    }

    /**
     * Reads and converts a variable with any converter.
     *
     * @param key The variable name.
     * @param converter The converter to apply.
     * @param <V> The target type.
     * @return The converted value, or empty if unset or not convertible.
     */
    public <V> Optional<V> get(String key, Converter<V> converter) {
        Optional<String> raw = env.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(converter.convert(raw.get()));
        } catch (ConversionException e) {
            LOG.debug("Ignoring {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads and converts a variable with any converter, falling back to a default.
     *
     * @param key The variable name.
     * @param converter The converter to apply.
     * @param defaultValue Returned when unset or not convertible.
     * @param <V> The target type.
     * @return The converted value or the default.
     */
    public <V> V getOr(String key, Converter<V> converter, V defaultValue) {
        return get(key, converter).orElse(defaultValue);
    }

    public Optional<String> getString(String key) {
        return env.get(key);
    }

    public String getStringOr(String key, String defaultValue) {
        return env.get(key).orElse(defaultValue);
    }

    public OptionalInt getInt(String key) {
        return get(key, Converters.int32()).map(OptionalInt::of).orElseGet(OptionalInt::empty);
    }

    public int getIntOr(String key, int defaultValue) {
        return getInt(key).orElse(defaultValue);
    }

    public OptionalLong getLong(String key) {
        return get(key, Converters.int64()).map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }

    public long getLongOr(String key, long defaultValue) {
        return getLong(key).orElse(defaultValue);
    }

    public Optional<Short> getShort(String key) {
        return get(key, Converters.int16());
    }

    public short getShortOr(String key, short defaultValue) {
        return getShort(key).orElse(defaultValue);
    }

    public Optional<Byte> getByte(String key) {
        return get(key, Converters.int8());
    }

    public byte getByteOr(String key, byte defaultValue) {
        return getByte(key).orElse(defaultValue);
    }

    /**
     * @param key The variable name.
     * @return The value as an unsigned 32-bit integer, or empty.
     */
    public OptionalLong getUnsignedInt(String key) {
        return get(key, Converters.uint32()).map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }

    public long getUnsignedIntOr(String key, long defaultValue) {
        return getUnsignedInt(key).orElse(defaultValue);
    }

    /**
     * @param key The variable name.
     * @return The value as an unsigned 64-bit integer in two's complement, or empty.
     * @see Converters#uint64()
     */
    public OptionalLong getUnsignedLong(String key) {
        return get(key, Converters.uint64()).map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }

    public long getUnsignedLongOr(String key, long defaultValue) {
        return getUnsignedLong(key).orElse(defaultValue);
    }

    public Optional<Float> getFloat(String key) {
        return get(key, Converters.float32());
    }

    public float getFloatOr(String key, float defaultValue) {
        return getFloat(key).orElse(defaultValue);
    }

    public OptionalDouble getDouble(String key) {
        return get(key, Converters.float64()).map(OptionalDouble::of).orElseGet(OptionalDouble::empty);
    }

    public double getDoubleOr(String key, double defaultValue) {
        return getDouble(key).orElse(defaultValue);
    }

    /**
     * @param key The variable name.
     * @return The value as a boolean, or empty.
     * @see Converters#bool()
     */
    public Optional<Boolean> getBoolean(String key) {
        return get(key, Converters.bool());
    }

    public boolean getBooleanOr(String key, boolean defaultValue) {
        return getBoolean(key).orElse(defaultValue);
    }

    /**
     * @param key The variable name.
     * @return The value as a duration such as {@code 1h30m}, or empty.
     */
    public Optional<Duration> getDuration(String key) {
        return get(key, Converters.duration());
    }

    public Duration getDurationOr(String key, Duration defaultValue) {
        return getDuration(key).orElse(defaultValue);
    }

    /**
     * @param key The variable name.
     * @return The comma-separated elements, trimmed, or an empty list if unset.
     */
    public List<String> getList(String key) {
        return getListOr(key, List.of());
    }

    public List<String> getListOr(String key, List<String> defaultValue) {
        return getOr(key, Converters.stringList(), defaultValue);
    }

    public void set(String key, String value) {
        env.set(key, value);
    }

    public void unset(String key) {
        env.unset(key);
    }

    public boolean has(String key) {
        return env.has(key);
    }
}
