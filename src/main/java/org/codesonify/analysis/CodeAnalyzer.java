package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Lexer;
import org.codesonify.analysis.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the lexical analysis pipeline: language detection, tokenization, structure extraction and metrics.
 * <p>
 * Analysis is a total function: any text, including the empty string, yields a result.
 * The analyzer holds no state between calls and is safe to share between threads.
 */
public class CodeAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CodeAnalyzer.class);

    /**
     * Analyzes source text, detecting its language.
     * @param source The source text.
     * @return The analysis.
     */
    public CodeAnalysis analyze(String source) {
        return analyze(source, null);
    }

    /**
     * Analyzes source text.
     *
     * @param source The source text.
     * @param languageHint The language to report, or {@code null} to detect it.
     * @return The analysis.
     */
    public CodeAnalysis analyze(String source, Language languageHint) {
        Language language = languageHint != null ? languageHint : LanguageDetector.detect(source);

        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.scanTokens();
        List<CodeStructure> structures = StructureExtractor.extract(tokens);
        CodeMetrics metrics = MetricsCalculator.calculate(lexer.getLines(), tokens);

        LOG.debug("Analyzed {} lines as {}: {} tokens, {} root structures, complexity {}",
                metrics.totalLines(), language, tokens.size(), structures.size(), metrics.complexity());
        return new CodeAnalysis(language, tokens, metrics, structures);
    }
}
