package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Token;
import org.codesonify.analysis.lexer.TokenKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CodeMetrics} from the lines and tokens of a source text.
 * <p>
 * The complexity score is the sum of four independently capped parts, clamped to 100:
 * <ul>
 *   <li>nesting: {@code min(maxDepth * 10, 30)}</li>
 *   <li>branching: {@code min((conditionals + loops) * 5, 30)}</li>
 *   <li>size: {@code min(codeLines * 0.5, 20)}</li>
 *   <li>functions: {@code min(functions * 3, 20)}</li>
 * </ul>
 */
public final class MetricsCalculator {

    static final int NESTING_CAP = 30;
    static final int BRANCHING_CAP = 30;
    static final double SIZE_CAP = 20;
    static final int FUNCTION_CAP = 20;

    private MetricsCalculator() {}

    /**
     * Calculates the metrics.
     * @param lines The lines of the source text.
     * @param tokens The tokens produced from those lines.
     * @return The metrics, all zero for an empty text.
     */
    public static CodeMetrics calculate(List<String> lines, List<Token> tokens) {
        Map<TokenKind, Integer> counts = new EnumMap<>(TokenKind.class);
        int maxDepth = 0;
        for (Token token : tokens) {
            counts.merge(token.kind(), 1, Integer::sum);
            maxDepth = Math.max(maxDepth, token.nestingDepth());
        }

        int totalLines = lines.size();
        int emptyLines = (int) lines.stream().filter(String::isBlank).count();
        int commentLines = count(counts, TokenKind.COMMENT);
        int codeLines = totalLines - emptyLines - commentLines;

        int functions = count(counts, TokenKind.FUNCTION);
        int loops = count(counts, TokenKind.LOOP);
        int conditionals = count(counts, TokenKind.CONDITIONAL);

        double nestingScore = Math.min(maxDepth * 10, NESTING_CAP);
        double branchScore = Math.min((conditionals + loops) * 5, BRANCHING_CAP);
        double sizeScore = Math.min(codeLines * 0.5, SIZE_CAP);
        double functionScore = Math.min(functions * 3, FUNCTION_CAP);
        double complexity = Math.min(100, nestingScore + branchScore + sizeScore + functionScore);

        return new CodeMetrics(
                totalLines,
                codeLines,
                commentLines,
                emptyLines,
                functions,
                loops,
                conditionals,
                count(counts, TokenKind.VARIABLE),
                count(counts, TokenKind.CLASS),
                count(counts, TokenKind.IMPORT),
                count(counts, TokenKind.ERROR_MARKER),
                maxDepth,
                (int) Math.round(complexity));
    }

    private static int count(Map<TokenKind, Integer> counts, TokenKind kind) {
        return counts.getOrDefault(kind, 0);
    }
}
