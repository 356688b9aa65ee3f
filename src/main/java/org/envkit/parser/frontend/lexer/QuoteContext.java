package org.envkit.parser.frontend.lexer;

/**
 * Defines how a value was written, which determines escape processing and expansion eligibility.
 */
public enum QuoteContext {
    /** No quotes; the value ends at a comment or line break. Expansion applies. */
    UNQUOTED('\0', true),
    /** Single quotes; every character is literal. Expansion does not apply. */
    SINGLE_QUOTED('\'', false),
    /** Double quotes; backslash escapes are interpreted. Expansion applies. */
    DOUBLE_QUOTED('"', true);

    private final char quoteChar;
    private final boolean expansionAllowed;

    QuoteContext(char quoteChar, boolean expansionAllowed) {
        this.quoteChar = quoteChar;
        this.expansionAllowed = expansionAllowed;
    }

    /**
     * @return The delimiting quote character, or {@code '\0'} for unquoted values.
     */
    public char quoteChar() {
        return quoteChar;
    }

    /**
     * @return Whether {@code $VAR} references in such a value are expanded.
     */
    public boolean isExpansionAllowed() {
        return expansionAllowed;
    }

    /**
     * Classifies a value by the character that starts it.
     * @param c The first character of the value.
     * @return The matching quote context.
     */
    public static QuoteContext of(char c) {
        if (c == '"') return DOUBLE_QUOTED;
        if (c == '\'') return SINGLE_QUOTED;
        return UNQUOTED;
    }
}
