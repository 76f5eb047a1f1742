package org.codesonify.api;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.CodeMetrics;
import org.codesonify.analysis.Language;
import org.codesonify.composition.Composition;
import org.codesonify.music.NoteName;
import org.codesonify.music.ScaleType;

/**
 * Side-by-side figures of two code compositions.
 *
 * @param a The first piece.
 * @param b The second piece.
 * @param verdict Which piece is musically faster.
 */
public record CompositionComparison(Side a, Side b, Verdict verdict) {

    /**
     * The outcome of comparing tempos; the faster piece stems from the more complex code.
     */
    public enum Verdict {
        A_FASTER("Code A is musically \"faster\" (more complex)"),
        B_FASTER("Code B is musically \"faster\" (more complex)"),
        SIMILAR("Both pieces have similar musical intensity");

        private final String description;

        Verdict(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    /**
     * The figures of one piece.
     *
     * @param language The detected language.
     * @param tempo Tempo in BPM.
     * @param key The reported key.
     * @param scale The reported scale.
     * @param durationSeconds The length in seconds.
     * @param complexity The complexity score.
     * @param noteCount Number of notes over all tracks.
     * @param functionCount Number of function tokens.
     * @param loopCount Number of loop tokens.
     * @param conditionalCount Number of conditional tokens.
     * @param trackCount Number of tracks.
     * @param interpretation The description of the piece.
     */
    public record Side(
            Language language,
            int tempo,
            NoteName key,
            ScaleType scale,
            double durationSeconds,
            int complexity,
            int noteCount,
            int functionCount,
            int loopCount,
            int conditionalCount,
            int trackCount,
            String interpretation
    ) {
        static Side of(CodeAnalysis analysis, Composition composition) {
            CodeMetrics metrics = analysis.metrics();
            return new Side(analysis.language(), composition.tempo(), composition.key(), composition.scale(),
                    composition.totalDurationSeconds(), metrics.complexity(), composition.noteCount(),
                    metrics.functionCount(), metrics.loopCount(), metrics.conditionalCount(),
                    composition.tracks().size(), composition.metadata().musicalInterpretation());
        }
    }

    /**
     * Compares two analyzed compositions.
     *
     * @param analysisA The analysis of the first input.
     * @param compositionA The composition of the first input.
     * @param analysisB The analysis of the second input.
     * @param compositionB The composition of the second input.
     * @return The comparison.
     */
    public static CompositionComparison of(CodeAnalysis analysisA, Composition compositionA,
                                           CodeAnalysis analysisB, Composition compositionB) {
        Side a = Side.of(analysisA, compositionA);
        Side b = Side.of(analysisB, compositionB);
        Verdict verdict;
        if (a.tempo() > b.tempo()) {
            verdict = Verdict.A_FASTER;
        } else if (b.tempo() > a.tempo()) {
            verdict = Verdict.B_FASTER;
        } else {
            verdict = Verdict.SIMILAR;
        }
        return new CompositionComparison(a, b, verdict);
    }
}
