package org.envkit.parser.frontend.expansion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} and {@code $NAME} references against variables defined earlier.
 * <p>
 * The braced form is substituted first over the whole value, then the bare form over the
 * result. Unresolved references are left verbatim and substituted text is never re-scanned.
 */
public final class VariableExpander {

    private static final Logger LOG = LoggerFactory.getLogger(VariableExpander.class);

    private static final Pattern BRACED = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final Pattern BARE = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private VariableExpander() {}

    /**
     * Expands all resolvable references in {@code value}.
     *
     * @param value The raw value.
     * @param defined The variables defined so far.
     * @return The expanded value.
     */
    public static String expand(String value, Map<String, String> defined) {
        if (value.indexOf('$') < 0) {
            return value;
        }
        String result = substitute(BRACED, value, defined);
        return substitute(BARE, result, defined);
    }

    private static String substitute(Pattern pattern, String input, Map<String, String> defined) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder(input.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String resolved = defined.get(name);
            if (resolved == null) {
                LOG.trace("Leaving unresolved reference '{}' as is", matcher.group());
                resolved = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
