package org.envkit.parser.api;

/**
 * Defines unique, testable error codes for all errors that can occur while parsing a dotenv document.
 * This decouples the test logic from the human-readable error messages.
 */
public enum ParseErrorCode {
    /** The first character of a key is not a letter or underscore, or there is no key at all. */
    INVALID_KEY,
    /** A key was required but the key scan yielded an empty name. */
    MISSING_VARIABLE_NAME,
    /** No '=' was found after the key. */
    MISSING_ASSIGNMENT,
    /** A quoted value was not closed before the end of the input. */
    UNTERMINATED_STRING
}
