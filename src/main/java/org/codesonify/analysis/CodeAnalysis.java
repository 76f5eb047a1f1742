package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Token;

import java.util.List;

/**
 * The result of analyzing one source text.
 *
 * @param language The hinted or detected language.
 * @param tokens All tokens in source order.
 * @param metrics Aggregate metrics over the tokens and lines.
 * @param structures The root structures of the structure tree.
 */
public record CodeAnalysis(
        Language language,
        List<Token> tokens,
        CodeMetrics metrics,
        List<CodeStructure> structures
) {
    public CodeAnalysis {
        tokens = List.copyOf(tokens);
        structures = List.copyOf(structures);
    }
}
