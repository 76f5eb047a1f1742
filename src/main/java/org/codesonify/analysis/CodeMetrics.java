package org.codesonify.analysis;

/**
 * Aggregate counts over one analyzed source text.
 *
 * @param totalLines Number of lines in the text.
 * @param codeLines Lines that are neither empty nor comments.
 * @param commentLines Lines recognized as comments.
 * @param emptyLines Empty or whitespace-only lines.
 * @param functionCount Number of function tokens.
 * @param loopCount Number of loop tokens.
 * @param conditionalCount Number of conditional tokens.
 * @param variableCount Number of variable declaration tokens.
 * @param classCount Number of class tokens.
 * @param importCount Number of import tokens.
 * @param errorCount Number of error marker tokens.
 * @param maxNestingDepth Deepest nesting depth seen on any token.
 * @param complexity Derived complexity score in [0, 100].
 */
public record CodeMetrics(
        int totalLines,
        int codeLines,
        int commentLines,
        int emptyLines,
        int functionCount,
        int loopCount,
        int conditionalCount,
        int variableCount,
        int classCount,
        int importCount,
        int errorCount,
        int maxNestingDepth,
        int complexity
) {
    /** Metrics of an empty text. */
    public static final CodeMetrics EMPTY = new CodeMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
}
