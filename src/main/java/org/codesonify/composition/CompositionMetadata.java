package org.codesonify.composition;

import org.codesonify.analysis.Language;

/**
 * Descriptive data about the input a composition was generated from.
 *
 * @param sourceLanguage The language of the source, {@link Language#UNKNOWN} for diffs.
 * @param linesAnalyzed Number of input lines.
 * @param complexity The complexity score, 0..100.
 * @param codeHash Hash of the input text, 8 hex digits.
 * @param musicalInterpretation A human-readable description of the piece.
 */
public record CompositionMetadata(
        Language sourceLanguage,
        int linesAnalyzed,
        int complexity,
        String codeHash,
        String musicalInterpretation
) {}
