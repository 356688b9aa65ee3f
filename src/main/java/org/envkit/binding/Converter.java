package org.envkit.binding;

/**
 * Converts the raw text of an environment variable into a typed value and back.
 *
 * @param <V> The target type.
 */
public interface Converter<V> {

    /**
     * @param raw The raw text.
     * @return The converted value.
     * @throws ConversionException if the text is not a valid representation.
     */
    V convert(String raw) throws ConversionException;

    /**
     * Formats a value so that {@link #convert(String)} accepts it again.
     * @param value The value, never {@code null}.
     * @return The textual representation.
     */
    default String format(V value) {
        return String.valueOf(value);
    }

    /**
     * @return A short name of the target type, used in error messages.
     */
    String typeName();
}
