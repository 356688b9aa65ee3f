package org.envkit.parser.frontend.parser;

import org.envkit.parser.api.ParseErrorCode;
import org.envkit.parser.frontend.lexer.QuoteContext;
import org.envkit.parser.frontend.lexer.Scanner;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link LineParser}.
 * These tests verify that single logical lines are turned into entries, blank results or errors.
 */
public class LineParserTest {

    private static List<ParsedLine> entries(String source, boolean exportPrefix) {
        LineParser parser = new LineParser(new Scanner(source), exportPrefix);
        List<ParsedLine> result = new ArrayList<>();
        while (parser.hasMoreLines()) {
            ParsedLine line = parser.parseLine();
            if (line.hasError()) {
                result.add(line);
                break;
            }
            if (!line.isBlank()) {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * Verifies that comments and blank lines produce no entries and that entry lines carry
     * their 1-based line numbers.
     */
    @Test
    @Tag("unit")
    void testCommentsAndBlankLinesAreSkipped() {
        // Arrange
        String source = String.join("\n",
                "# header",
                "",
                "   ",
                "A=1",
                "  # indented comment",
                "B=2");

        // Act
        List<ParsedLine> lines = entries(source, true);

        // Assert
        assertThat(lines).extracting(ParsedLine::key, ParsedLine::value, ParsedLine::line)
                .containsExactly(
                        tuple("A", "1", 4),
                        tuple("B", "2", 6));
    }

    /**
     * Verifies the quote context recorded for each value style.
     */
    @Test
    @Tag("unit")
    void testQuoteContextIsRecorded() {
        List<ParsedLine> lines = entries("U=plain\nD=\"double\"\nS='single'", true);

        assertThat(lines).extracting(ParsedLine::quoteContext)
                .containsExactly(QuoteContext.UNQUOTED, QuoteContext.DOUBLE_QUOTED, QuoteContext.SINGLE_QUOTED);
        assertThat(lines).extracting(ParsedLine::allowExpansion).containsExactly(true, true, false);
    }

    @Test
    @Tag("unit")
    void testExportPrefixAndSpacesAroundAssignment() {
        List<ParsedLine> lines = entries("export   KEY  =  value", true);

        assertThat(lines).singleElement().satisfies(line -> {
            assertThat(line.key()).isEqualTo("KEY");
            assertThat(line.value()).isEqualTo("value");
        });
    }

    /**
     * Verifies that with the export prefix disabled, {@code export} is read as a key and the
     * line fails for lack of an assignment.
     */
    @Test
    @Tag("unit")
    void testExportPrefixDisabled() {
        List<ParsedLine> lines = entries("export KEY=value", false);

        assertThat(lines).singleElement().satisfies(line -> {
            assertThat(line.hasError()).isTrue();
            assertThat(line.error().code()).isEqualTo(ParseErrorCode.MISSING_ASSIGNMENT);
        });
    }

    /**
     * Verifies that a comment after a quoted value is ignored.
     */
    @Test
    @Tag("unit")
    void testCommentAfterQuotedValue() {
        List<ParsedLine> lines = entries("KEY2=\"quoted value\" # comment\nNEXT=ok", true);

        assertThat(lines).extracting(ParsedLine::key, ParsedLine::value)
                .containsExactly(
                        tuple("KEY2", "quoted value"),
                        tuple("NEXT", "ok"));
    }

    /**
     * Verifies that a line without {@code =} is reported as a missing assignment on that line.
     */
    @Test
    @Tag("unit")
    void testMissingAssignmentIsReportedOnItsLine() {
        List<ParsedLine> lines = entries("A=1\nKEY_WITHOUT_EQUALS\n", true);

        assertThat(lines).hasSize(2);
        ParsedLine failed = lines.get(1);
        assertThat(failed.error().code()).isEqualTo(ParseErrorCode.MISSING_ASSIGNMENT);
        assertThat(failed.line()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testLineStartingWithAssignmentIsInvalidKey() {
        List<ParsedLine> lines = entries("=value", true);

        assertThat(lines).singleElement()
                .extracting(line -> line.error().code())
                .isEqualTo(ParseErrorCode.INVALID_KEY);
    }
}
