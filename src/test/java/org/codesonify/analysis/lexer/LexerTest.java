package org.codesonify.analysis.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify the fragment splitting, the classification priority and the per-line depth tracking.
 */
public class LexerTest {

    /**
     * Verifies the token stream of a one-line function: the declaring keyword is a function token, the
     * declared name is not, and brackets, operators and the return keyword are classified.
     */
    @Test
    @Tag("unit")
    void testFunctionDeclarationTokens() {
        // Arrange
        Lexer lexer = new Lexer("function add(a, b) { return a + b; }");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly(
                "function", "add", "(", "a", ",", "b", ")", "{", "return", "a", "+", "b", ";", "}");
        assertThat(tokens).extracting(Token::kind).containsExactly(
                TokenKind.FUNCTION, TokenKind.UNKNOWN, TokenKind.BRACKET_OPEN, TokenKind.UNKNOWN,
                TokenKind.UNKNOWN, TokenKind.UNKNOWN, TokenKind.BRACKET_CLOSE, TokenKind.BRACKET_OPEN,
                TokenKind.RETURN_STMT, TokenKind.UNKNOWN, TokenKind.OPERATOR, TokenKind.UNKNOWN,
                TokenKind.UNKNOWN, TokenKind.BRACKET_CLOSE);
        assertThat(tokens).allSatisfy(token -> assertThat(token.nestingDepth()).isZero());
    }

    @Test
    @Tag("unit")
    void testCallTargetIsFunction() {
        List<Token> tokens = new Lexer("result = compute(x)").scanTokens();

        assertThat(tokens).extracting(Token::text, Token::kind).contains(
                tuple("compute", TokenKind.FUNCTION),
                tuple("result", TokenKind.UNKNOWN),
                tuple("=", TokenKind.OPERATOR));
    }

    @Test
    @Tag("unit")
    void testLiteralsAndDeclarations() {
        List<Token> tokens = new Lexer("let s = \"hi\" + 42").scanTokens();

        assertThat(tokens).extracting(Token::kind).containsExactly(
                TokenKind.VARIABLE, TokenKind.UNKNOWN, TokenKind.OPERATOR, TokenKind.STRING,
                TokenKind.OPERATOR, TokenKind.NUMBER);
    }

    /**
     * Verifies that comment and blank lines each produce exactly one whole-line token.
     */
    @Test
    @Tag("unit")
    void testWholeLineTokens() {
        // Arrange
        String source = String.join("\n",
                "  // a comment",
                "",
                "# another one",
                "x");

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(0)).extracting(Token::kind, Token::text, Token::line, Token::column)
                .containsExactly(TokenKind.COMMENT, "// a comment", 1, 2);
        assertThat(tokens.get(1)).extracting(Token::kind, Token::line).containsExactly(TokenKind.WHITESPACE, 2);
        assertThat(tokens.get(2)).extracting(Token::kind, Token::line).containsExactly(TokenKind.COMMENT, 3);
        assertThat(tokens.get(3)).extracting(Token::kind, Token::text).containsExactly(TokenKind.UNKNOWN, "x");
    }

    /**
     * Verifies that the depth of a line is the depth before the line, updated by its bracket balance.
     */
    @Test
    @Tag("unit")
    void testNestingDepthIsAppliedAfterEachLine() {
        // Arrange
        String source = String.join("\n",
                "if (x) {",
                "  y = 1",
                "}",
                "z");

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).filteredOn(token -> token.line() == 1)
                .allSatisfy(token -> assertThat(token.nestingDepth()).isZero());
        assertThat(tokens).filteredOn(token -> token.line() == 2)
                .allSatisfy(token -> assertThat(token.nestingDepth()).isEqualTo(1));
        assertThat(tokens).filteredOn(token -> token.line() == 3)
                .allSatisfy(token -> assertThat(token.nestingDepth()).isEqualTo(1));
        assertThat(tokens).filteredOn(token -> token.line() == 4)
                .allSatisfy(token -> assertThat(token.nestingDepth()).isZero());
    }

    @Test
    @Tag("unit")
    void testUnmatchedClosingBracketsNeverProduceNegativeDepth() {
        List<Token> tokens = new Lexer("}}}\n)) x\n{ y").scanTokens();

        assertThat(tokens).allSatisfy(token -> assertThat(token.nestingDepth()).isGreaterThanOrEqualTo(0));
        assertThat(tokens.get(tokens.size() - 1).nestingDepth()).isZero();
    }

    @Test
    @Tag("unit")
    void testColumnsFollowFragments() {
        List<Token> tokens = new Lexer("    for i").scanTokens();

        assertThat(tokens).extracting(Token::column).containsExactly(4, 8);
    }

    @Test
    @Tag("unit")
    void testEmptySourceHasNoLinesAndNoTokens() {
        Lexer lexer = new Lexer("");

        assertThat(lexer.scanTokens()).isEmpty();
        assertThat(lexer.getLines()).isEmpty();
        assertThat(Lexer.splitLines("a\n")).containsExactly("a", "");
    }

    @Test
    @Tag("unit")
    void testTokenClampsNegativeDepth() {
        assertThat(new Token(TokenKind.UNKNOWN, "x", 1, 0, -3).nestingDepth()).isZero();
    }

    @Test
    @Tag("unit")
    void testNoBreakSpacesAreWhitespace() {
        List<Token> tokens = new Lexer("\u00A0\u00A0\nx\u00A0y\n\u2003let z").scanTokens();

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.WHITESPACE);
        assertThat(tokens.subList(1, 3)).extracting(Token::text).containsExactly("x", "y");
        assertThat(tokens.get(3).kind()).isEqualTo(TokenKind.VARIABLE);
        assertThat(tokens.get(3).column()).isEqualTo(1);
        assertThat(tokens).hasSize(5);
    }
}
