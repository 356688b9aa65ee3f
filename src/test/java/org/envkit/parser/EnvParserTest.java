package org.envkit.parser;

import org.envkit.parser.api.IEnvParser;
import org.envkit.parser.api.ParseErrorCode;
import org.envkit.parser.api.ParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the {@link EnvParser}.
 * These tests run whole documents through the parser and check the resulting mapping,
 * covering value styles, comments, escapes, variable expansion and error reporting.
 * These are unit tests and do not require external resources.
 */
public class EnvParserTest {

    private final IEnvParser parser = new EnvParser();

    /**
     * Verifies a typical document with every value style, in the order keys were defined.
     */
    @Test
    @Tag("unit")
    void testParsesMixedDocument() throws ParseException {
        // Arrange
        String source = String.join("\n",
                "# Database",
                "KEY1=value1",
                "KEY2=\"quoted value\" # comment",
                "KEY3=    value with leading spaces",
                "export KEY4='single quoted'",
                "EMPTY=",
                "SPACES=   ",
                "");

        // Act
        Map<String, String> env = parser.parse(source);

        // Assert
        assertThat(env).containsExactly(
                entry("KEY1", "value1"),
                entry("KEY2", "quoted value"),
                entry("KEY3", "value with leading spaces"),
                entry("KEY4", "single quoted"),
                entry("EMPTY", ""),
                entry("SPACES", ""));
    }

    /**
     * Verifies that trailing whitespace of unquoted values is trimmed but inner whitespace is kept.
     */
    @Test
    @Tag("unit")
    void testUnquotedValueKeepsInnerWhitespace() throws ParseException {
        Map<String, String> env = parser.parse("K=  a  b \t\n");

        assertThat(env).containsExactly(entry("K", "a  b"));
    }

    /**
     * Verifies that {@code #} starts a comment only outside quotes.
     */
    @Test
    @Tag("unit")
    void testHashInsideQuotesIsLiteral() throws ParseException {
        // Arrange
        String source = "A=v # comment\nB=\"v # not comment\"\nC='v # not comment either'\nD=v#tight";

        // Act
        Map<String, String> env = parser.parse(source);

        // Assert
        assertThat(env).containsExactly(
                entry("A", "v"),
                entry("B", "v # not comment"),
                entry("C", "v # not comment either"),
                entry("D", "v"));
    }

    /**
     * Verifies that escapes are decoded in double quotes only.
     */
    @Test
    @Tag("unit")
    void testEscapesOnlyInDoubleQuotes() throws ParseException {
        Map<String, String> env = parser.parse("D=\"a\\nb\\tc\"\nS='a\\nb'\nU=a\\nb\nX=\"test\\x\"");

        assertThat(env).containsEntry("D", "a\nb\tc")
                .containsEntry("S", "a\\nb")
                .containsEntry("U", "a\\nb")
                .containsEntry("X", "test\\x");
    }

    /**
     * Verifies that single quotes block expansion while double quotes and unquoted values expand.
     */
    @Test
    @Tag("unit")
    void testSingleQuotesBlockExpansion() throws ParseException {
        // Arrange
        String source = "B=x\nA1='$B literal'\nA2=\"$B literal\"\nA3=$B literal";

        // Act
        Map<String, String> env = parser.parse(source);

        // Assert
        assertThat(env).containsEntry("A1", "$B literal")
                .containsEntry("A2", "x literal")
                .containsEntry("A3", "x literal");
    }

    /**
     * Verifies braced expansion against earlier keys.
     */
    @Test
    @Tag("unit")
    void testBracedExpansion() throws ParseException {
        String source = "HOME_DIR=/home/app\nPATH_ORIG=/usr/bin\nPATH=\"${HOME_DIR}/bin:${PATH_ORIG}\"";

        Map<String, String> env = parser.parse(source);

        assertThat(env).containsEntry("PATH", "/home/app/bin:/usr/bin");
    }

    /**
     * Verifies that a reference to a key defined later stays unexpanded.
     */
    @Test
    @Tag("unit")
    void testForwardReferenceIsNotExpanded() throws ParseException {
        Map<String, String> env = parser.parse("A=\"${B}\"\nB=val");

        assertThat(env).containsExactly(entry("A", "${B}"), entry("B", "val"));
    }

    /**
     * Verifies that expanded text is not expanded again and that redefinitions see the
     * previous value.
     */
    @Test
    @Tag("unit")
    void testNoRecursiveExpansionAndRedefinition() throws ParseException {
        // Arrange
        String source = String.join("\n",
                "RAW='$OTHER'",
                "OTHER=o",
                "REF=$RAW",
                "P=a",
                "P=${P}b");

        // Act
        Map<String, String> env = parser.parse(source);

        // Assert
        assertThat(env).containsEntry("REF", "$OTHER")
                .containsEntry("P", "ab");
    }

    @Test
    @Tag("unit")
    void testCrLfLineEndings() throws ParseException {
        Map<String, String> env = parser.parse("A=1\r\nB=\"two\"\r\n# c\r\nC=3\r\n");

        assertThat(env).containsExactly(entry("A", "1"), entry("B", "two"), entry("C", "3"));
    }

    @Test
    @Tag("unit")
    void testQuotedValueMaySpanLines() throws ParseException {
        Map<String, String> env = parser.parse("CERT=\"line1\nline2\"\nNEXT=1");

        assertThat(env).containsExactly(entry("CERT", "line1\nline2"), entry("NEXT", "1"));
    }

    /**
     * Verifies that parsing a file names it in error messages.
     */
    @Test
    @Tag("unit")
    void testParseFileNamesSourceInErrors(@TempDir Path tempDir) throws IOException, ParseException {
        // Arrange
        Path good = tempDir.resolve("good.env");
        Path bad = tempDir.resolve("bad.env");
        Files.writeString(good, "A=1\n", StandardCharsets.UTF_8);
        Files.writeString(bad, "A=1\nB\n", StandardCharsets.UTF_8);

        // Act
        Map<String, String> env = parser.parse(good);

        // Assert
        assertThat(env).containsExactly(entry("A", "1"));
        assertThatThrownBy(() -> parser.parse(bad))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("bad.env:2:");
    }

    @Test
    @Tag("unit")
    void testEmptyDocument() throws ParseException {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("\n# only a comment\n\n")).isEmpty();
    }

    /**
     * Verifies that the returned mapping cannot be modified.
     */
    @Test
    @Tag("unit")
    void testResultIsUnmodifiable() throws ParseException {
        Map<String, String> env = parser.parse("A=1");

        assertThatThrownBy(() -> env.put("B", "2")).isInstanceOf(UnsupportedOperationException.class);
    }

    /**
     * Verifies that with the export prefix disabled, an {@code export} line is an error.
     */
    @Test
    @Tag("unit")
    void testExportPrefixCanBeDisabled() {
        IEnvParser strict = new EnvParser(false);

        assertThatThrownBy(() -> strict.parse("export A=1"))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getCode())
                .isEqualTo(ParseErrorCode.MISSING_ASSIGNMENT);
    }

    static Stream<Arguments> malformedDocuments() {
        return Stream.of(
                Arguments.of("KEY_WITHOUT_EQUALS", ParseErrorCode.MISSING_ASSIGNMENT, 1),
                Arguments.of("KEY=\"unterminated", ParseErrorCode.UNTERMINATED_STRING, 1),
                Arguments.of("123INVALID=value", ParseErrorCode.INVALID_KEY, 1),
                Arguments.of("A=1\nB=2\n-C=3", ParseErrorCode.INVALID_KEY, 3),
                Arguments.of("A=1\nB='open\nstill open\n", ParseErrorCode.UNTERMINATED_STRING, 2),
                Arguments.of("A=1\n\nK=\"a\" junk", ParseErrorCode.MISSING_ASSIGNMENT, 3));
    }

    /**
     * Verifies that each malformed document fails with the expected code at the line
     * where the offending construct began.
     */
    @ParameterizedTest
    @MethodSource("malformedDocuments")
    @Tag("unit")
    void testErrorsCarryCodeAndLine(String source, ParseErrorCode code, int line) {
        assertThatThrownBy(() -> parser.parse(source, "test.env"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException ex = (ParseException) e;
                    assertThat(ex.getCode()).isEqualTo(code);
                    assertThat(ex.getLineNumber()).isEqualTo(line);
                    assertThat(ex.getSourceName()).isEqualTo("test.env");
                    assertThat(ex.getMessage()).startsWith("test.env:" + line + ": ");
                });
    }
}
