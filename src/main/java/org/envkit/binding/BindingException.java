package org.envkit.binding;

/**
 * Thrown when an {@link EnvBinder} cannot populate a target object.
 * The failing variable is identified by its environment key.
 */
public class BindingException extends Exception {

    /**
     * The kinds of binding failures.
     */
    public enum Code {
        /** A variable declared as required is not set and has no default. */
        REQUIRED_MISSING,
        /** The value of a variable cannot be converted to the field's type. */
        CONVERSION_FAILED
    }

    private final Code code;
    private final String key;

    /**
     * @param code The kind of failure.
     * @param key The environment key of the failing field.
     * @param message The detail message.
     * @param cause The cause, may be {@code null}.
     */
    public BindingException(Code code, String key, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.key = key;
    }

    public Code getCode() {
        return code;
    }

    public String getKey() {
        return key;
    }
}
