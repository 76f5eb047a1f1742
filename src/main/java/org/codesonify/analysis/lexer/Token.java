package org.codesonify.analysis.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param kind The kind of the token (e.g., function, loop, operator).
 * @param text The exact text of the token from the source code.
 * @param line The 1-based line number where the token was found.
 * @param column The 0-based column where the token begins (best effort).
 * @param nestingDepth The bracket nesting depth in effect at the start of the token's line, never negative.
 */
public record Token(
        TokenKind kind,
        String text,
        int line,
        int column,
        int nestingDepth
) {
    public Token {
        nestingDepth = Math.max(0, nestingDepth);
    }
}
