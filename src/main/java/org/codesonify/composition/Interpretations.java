package org.codesonify.composition;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.CodeMetrics;
import org.codesonify.music.MusicStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the human-readable description of a code composition from metric thresholds.
 */
public final class Interpretations {

    private Interpretations() {}

    /**
     * Describes the composition generated for an analysis.
     *
     * @param analysis The code analysis.
     * @param style The style the piece was rendered in.
     * @return One sentence, ending in a period.
     */
    public static String describe(CodeAnalysis analysis, MusicStyle style) {
        CodeMetrics metrics = analysis.metrics();
        List<String> parts = new ArrayList<>();

        if (metrics.complexity() > 70) {
            parts.add("A complex, intense composition reflecting deeply nested logic");
        } else if (metrics.complexity() > 40) {
            parts.add("A balanced piece with moderate complexity");
        } else {
            parts.add("A clean, minimalist arrangement reflecting simple, elegant code");
        }

        if (metrics.functionCount() > 5) {
            parts.add("with " + metrics.functionCount() + " melodic phrases representing well-organized functions");
        } else if (metrics.functionCount() > 0) {
            parts.add("featuring " + metrics.functionCount() + " melodic theme" + plural(metrics.functionCount()));
        }

        if (metrics.loopCount() > 3) {
            parts.add("driven by strong, repetitive rhythmic patterns");
        } else if (metrics.loopCount() > 0) {
            parts.add("with subtle rhythmic elements");
        }

        if (metrics.conditionalCount() > 5) {
            parts.add("rich harmonic changes reflecting branching logic");
        } else if (metrics.conditionalCount() > 0) {
            parts.add("and gentle harmonic shifts");
        }

        if (metrics.errorCount() > 0) {
            parts.add("with " + metrics.errorCount() + " dissonant moment" + plural(metrics.errorCount())
                    + " signaling potential issues");
        }

        parts.add("Rendered in " + style.id() + " style");
        parts.add("from " + analysis.language().id() + " source code (" + metrics.totalLines() + " lines)");

        return String.join(", ", parts) + ".";
    }

    static String plural(int count) {
        return count == 1 ? "" : "s";
    }
}
