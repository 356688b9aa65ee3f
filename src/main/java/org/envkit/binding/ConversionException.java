package org.envkit.binding;

/**
 * Thrown by a {@link Converter} when raw text cannot be converted to the target type.
 */
public class ConversionException extends Exception {

    /**
     * @param message The detail message.
     */
    public ConversionException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
