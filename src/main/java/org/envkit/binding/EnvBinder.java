package org.envkit.binding;

import org.envkit.env.EnvironmentAccessor;
import org.envkit.env.MapEnvironmentAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Populates objects of type {@code T} from environment variables and turns them back into
 * variables. The mapping is a table of {@link FieldBinding}s declared once through
 * {@link #builder(Class)}; no reflection is involved.
 *
 * <pre>
 * EnvBinder&lt;ServerSettings&gt; binder = EnvBinder.builder(ServerSettings.class)
 *         .field("host", "HOST", Converters.string(), ServerSettings::getHost, ServerSettings::setHost)
 *             .defaultValue("localhost")
 *         .field("port", "PORT", Converters.int32(), ServerSettings::getPort, ServerSettings::setPort)
 *             .required()
 *         .build();
 * </pre>
 *
 * @param <T> The target type.
 */
public final class EnvBinder<T> {

    private static final Logger LOG = LoggerFactory.getLogger(EnvBinder.class);

    private final Class<T> type;
    private final List<FieldBinding<T, ?>> fields;

    private EnvBinder(Class<T> type, List<FieldBinding<T, ?>> fields) {
        this.type = type;
        this.fields = List.copyOf(fields);
    }

    /**
     * Starts declaring the field table of {@code type}.
     * @param type The target type.
     * @param <T> The target type.
     * @return A new builder.
     */
    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    /**
     * @return The declared fields, in declaration order.
     */
    public List<FieldBinding<T, ?>> fields() {
        return fields;
    }

    /**
     * Populates {@code target} from {@code env}.
     *
     * @param target The object to populate.
     * @param env The variables to read.
     * @throws BindingException if a required variable is missing or a value cannot be converted.
     */
    public void bind(T target, EnvironmentAccessor env) throws BindingException {
        bind(target, env, "");
    }

    /**
     * Populates {@code target} from {@code env}, prepending {@code prefix} to every key.
     *
     * @param target The object to populate.
     * @param env The variables to read.
     * @param prefix The key prefix, e.g. {@code APP_}.
     * @throws BindingException if a required variable is missing or a value cannot be converted.
     */
    public void bind(T target, EnvironmentAccessor env, String prefix) throws BindingException {
        for (FieldBinding<T, ?> field : fields) {
            bindField(target, field, env, prefix);
        }
    }

    /**
     * Populates {@code target} from a parsed mapping.
     *
     * @param target The object to populate.
     * @param variables The variables to read.
     * @throws BindingException if a required variable is missing or a value cannot be converted.
     */
    public void bind(T target, Map<String, String> variables) throws BindingException {
        bind(target, new MapEnvironmentAccessor(variables), "");
    }

    private <V> void bindField(T target, FieldBinding<T, V> field, EnvironmentAccessor env, String prefix)
            throws BindingException {
        String key = prefix + field.envKey();
        Optional<String> raw = env.get(key);
        String text;
        if (raw.isPresent()) {
            text = raw.get();
        } else if (field.required()) {
            throw new BindingException(BindingException.Code.REQUIRED_MISSING, key,
                    "Required environment variable " + key + " is not set", null);
        } else if (field.defaultValue() != null) {
            text = field.defaultValue();
        } else {
            LOG.trace("{}.{}: {} not set, left unchanged", type.getSimpleName(), field.fieldName(), key);
            return;
        }

        V value;
        try {
            value = field.converter().convert(text);
        } catch (ConversionException e) {
            throw new BindingException(BindingException.Code.CONVERSION_FAILED, key,
                    "Failed to parse " + field.converter().typeName() + " for " + key + ": " + e.getMessage(), e);
        }
        field.setter().accept(target, value);
    }

    /**
     * Turns {@code source} into variables. Fields whose value is {@code null} or formats
     * to an empty string are skipped.
     *
     * @param source The object to read.
     * @return The variables, in field declaration order.
     */
    public Map<String, String> marshal(T source) {
        return marshal(source, "");
    }

    /**
     * Turns {@code source} into variables, prepending {@code prefix} to every key.
     *
     * @param source The object to read.
     * @param prefix The key prefix.
     * @return The variables, in field declaration order.
     */
    public Map<String, String> marshal(T source, String prefix) {
        Map<String, String> env = new LinkedHashMap<>();
        for (FieldBinding<T, ?> field : fields) {
            String text = formatField(source, field);
            if (text != null && !text.isEmpty()) {
                env.put(prefix + field.envKey(), text);
            }
        }
        return Collections.unmodifiableMap(env);
    }

    private <V> String formatField(T source, FieldBinding<T, V> field) {
        V value = field.getter().apply(source);
        return value == null ? null : field.converter().format(value);
    }

    /**
     * Declares the field table of an {@link EnvBinder}. {@link #required()} and
     * {@link #defaultValue(String)} apply to the most recently declared field.
     *
     * @param <T> The target type.
     */
    public static final class Builder<T> {

        private final Class<T> type;
        private final List<FieldBinding<T, ?>> fields = new ArrayList<>();

        private Builder(Class<T> type) {
            this.type = type;
        }

        /**
         * Declares a field.
         *
         * @param fieldName The field name, for diagnostics.
         * @param envKey The environment key.
         * @param converter The converter for the field's type.
         * @param getter Reads the field.
         * @param setter Writes the field.
         * @param <V> The field type.
         * @return This builder.
         */
        public <V> Builder<T> field(String fieldName, String envKey, Converter<V> converter,
                                    Function<T, V> getter, BiConsumer<T, V> setter) {
            if (envKey == null || envKey.isEmpty()) {
                throw new IllegalArgumentException("Field '" + fieldName + "' has no environment key");
            }
            fields.add(new FieldBinding<>(fieldName, envKey, false, null, converter, getter, setter));
            return this;
        }

        /**
         * Declares a field from a tag string such as {@code PORT,required,default=8080}.
         *
         * @param fieldName The field name, for diagnostics.
         * @param tag The tag string.
         * @param converter The converter for the field's type.
         * @param getter Reads the field.
         * @param setter Writes the field.
         * @param <V> The field type.
         * @return This builder.
         */
        public <V> Builder<T> tagged(String fieldName, String tag, Converter<V> converter,
                                     Function<T, V> getter, BiConsumer<T, V> setter) {
            FieldBinding.Tag parsed = FieldBinding.Tag.parse(tag);
            fields.add(new FieldBinding<>(fieldName, parsed.envKey(), parsed.required(), parsed.defaultValue(),
                    converter, getter, setter));
            return this;
        }

        /**
         * Marks the last declared field as required.
         * @return This builder.
         */
        public Builder<T> required() {
            FieldBinding<T, ?> last = last();
            fields.set(fields.size() - 1, withOptions(last, true, last.defaultValue()));
            return this;
        }

        /**
         * Sets the default of the last declared field.
         * @param literal The raw text used when the variable is not set.
         * @return This builder.
         */
        public Builder<T> defaultValue(String literal) {
            FieldBinding<T, ?> last = last();
            fields.set(fields.size() - 1, withOptions(last, last.required(), literal));
            return this;
        }

        /**
         * @return The binder.
         */
        public EnvBinder<T> build() {
            return new EnvBinder<>(type, fields);
        }

        private FieldBinding<T, ?> last() {
            if (fields.isEmpty()) {
                throw new IllegalStateException("No field declared yet");
            }
            return fields.get(fields.size() - 1);
        }

        private static <T, V> FieldBinding<T, V> withOptions(FieldBinding<T, V> field, boolean required, String defaultValue) {
            return new FieldBinding<>(field.fieldName(), field.envKey(), required, defaultValue,
                    field.converter(), field.getter(), field.setter());
        }
    }
}
