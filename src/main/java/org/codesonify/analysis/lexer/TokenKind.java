package org.codesonify.analysis.lexer;

/**
 * Defines the different kinds of tokens that the {@link Lexer} can recognize.
 */
public enum TokenKind {
    // Structural constructs.
    /** A function declaration keyword or an identifier used as a call target. */
    FUNCTION,
    /** A loop keyword such as {@code for} or {@code while}. */
    LOOP,
    /** A branching keyword such as {@code if} or {@code else}. */
    CONDITIONAL,
    /** A declaration keyword such as {@code let} or {@code const}. */
    VARIABLE,
    /** A type declaration keyword such as {@code class} or {@code struct}. */
    CLASS,

    // Literals.
    /** A fragment starting with a quote character. */
    STRING,
    /** An integer or decimal literal. */
    NUMBER,
    /** A fragment made only of operator characters. */
    OPERATOR,

    // Whole-line tokens.
    /** A line starting with a comment marker. */
    COMMENT,
    /** An empty or whitespace-only line. */
    WHITESPACE,

    // Keywords.
    /** An import keyword such as {@code import} or {@code use}. */
    IMPORT,
    /** A control transfer keyword such as {@code return} or {@code throw}. */
    RETURN_STMT,
    /** A marker for erroneous code. The keyword table does not produce it on its own. */
    ERROR_MARKER,
    /** Any other recognized keyword. */
    KEYWORD,

    // Punctuation.
    /** A single opening bracket: {@code ( [ {}. */
    BRACKET_OPEN,
    /** A single closing bracket: {@code ) ] }}. */
    BRACKET_CLOSE,

    // Miscellaneous.
    /** Anything that matches no other rule. */
    UNKNOWN;

    /**
     * Checks whether tokens of this kind open a {@code CodeStructure}.
     * @return {@code true} for functions, classes, loops and conditionals.
     */
    public boolean isStructural() {
        return this == FUNCTION || this == CLASS || this == LOOP || this == CONDITIONAL;
    }
}
