package org.envkit.parser;

import org.envkit.parser.api.IEnvParser;
import org.envkit.parser.api.ParseException;
import org.envkit.parser.frontend.expansion.VariableExpander;
import org.envkit.parser.frontend.lexer.Scanner;
import org.envkit.parser.frontend.parser.LineParser;
import org.envkit.parser.frontend.parser.ParsedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The main parser implementation. It runs the {@link LineParser} across the whole
 * document, accumulating entries into the result mapping and expanding variable
 * references against the entries defined on earlier lines.
 * <p>
 * Instances hold only immutable options and may be shared between threads; every
 * call to {@link #parse(String, String)} works on its own scanner and mapping.
 */
public class EnvParser implements IEnvParser {

    private static final Logger LOG = LoggerFactory.getLogger(EnvParser.class);

    private final boolean exportPrefixEnabled;

    /**
     * Creates a parser that accepts the optional {@code export} prefix.
     */
    public EnvParser() {
        this(true);
    }

    /**
     * Creates a parser.
     * @param exportPrefixEnabled Whether a leading {@code export } is skipped on each line.
     */
    public EnvParser(boolean exportPrefixEnabled) {
        this.exportPrefixEnabled = exportPrefixEnabled;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The first malformed line aborts the parse; no partial mapping is returned.
     */
    @Override
    public Map<String, String> parse(String text, String sourceName) throws ParseException {
        LineParser lineParser = new LineParser(new Scanner(text, sourceName), exportPrefixEnabled);
        Map<String, String> env = new LinkedHashMap<>();

        while (lineParser.hasMoreLines()) {
            ParsedLine result = lineParser.parseLine();
            if (result.hasError()) {
                throw new ParseException(result.error());
            }
            if (result.isBlank()) {
                continue;
            }

            String value = result.value();
            if (result.allowExpansion() && value.indexOf('$') >= 0) {
                value = VariableExpander.expand(value, env);
                LOG.trace("{}:{}: expanded {} to '{}'", sourceName, result.line(), result.key(), value);
            }

            if (env.put(result.key(), value) != null) {
                LOG.debug("{}:{}: redefinition of {} overrides earlier value", sourceName, result.line(), result.key());
            }
        }

        LOG.debug("Parsed {} variables from {}", env.size(), sourceName);
        return Collections.unmodifiableMap(env);
    }
}
