package org.envkit.binding;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Describes how one field of a target type maps to an environment variable.
 *
 * @param fieldName The name of the target field, for diagnostics.
 * @param envKey The environment key, without any prefix.
 * @param required Whether binding fails when the variable is not set.
 * @param defaultValue The raw text used when the variable is not set, or {@code null}.
 * @param converter The converter for the field's type.
 * @param getter Reads the field from a target, used when marshalling.
 * @param setter Writes the field into a target, used when binding.
 * @param <T> The target type.
 * @param <V> The field type.
 */
public record FieldBinding<T, V>(
        String fieldName,
        String envKey,
        boolean required,
        String defaultValue,
        Converter<V> converter,
        Function<T, V> getter,
        BiConsumer<T, V> setter
) {

    /**
     * Options parsed from a tag string such as {@code PORT,required,default=8080}.
     *
     * @param envKey The environment key.
     * @param required Whether the {@code required} option is present.
     * @param defaultValue The {@code default=} literal, or {@code null} if absent or empty.
     */
    public record Tag(String envKey, boolean required, String defaultValue) {

        /**
         * Parses a tag. The first comma-separated part is the key; the remaining parts are
         * options. Unknown options are ignored.
         *
         * @param tag The tag string.
         * @return The parsed tag.
         * @throws IllegalArgumentException if the key part is empty.
         */
        public static Tag parse(String tag) {
            String[] parts = tag.split(",");
            String key = parts[0].trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Tag has no environment key: '" + tag + "'");
            }
            boolean required = false;
            String defaultValue = null;
            for (int i = 1; i < parts.length; i++) {
                String option = parts[i].trim();
                if (option.equals("required")) {
                    required = true;
                } else if (option.startsWith("default=")) {
                    String literal = option.substring("default=".length());
                    defaultValue = literal.isEmpty() ? null : literal;
                }
            }
            return new Tag(key, required, defaultValue);
        }
    }
}
