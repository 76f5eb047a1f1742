package org.codesonify.cli.rendering;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.CodeMetrics;
import org.codesonify.analysis.CodeStructure;
import org.codesonify.api.CompositionComparison;
import org.codesonify.composition.Composition;
import org.codesonify.composition.Track;
import org.codesonify.music.MusicStyle;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text reports printed by the commands.
 */
public final class TextReports {

    private TextReports() {}

    public static String analysis(CodeAnalysis analysis) {
        CodeMetrics m = analysis.metrics();
        StringBuilder out = new StringBuilder();
        out.append("Code Analysis\n\n");
        out.append("Language:      ").append(analysis.language()).append('\n');
        out.append("Lines:         ").append(m.totalLines()).append(" (").append(m.codeLines()).append(" code, ")
                .append(m.commentLines()).append(" comment, ").append(m.emptyLines()).append(" empty)\n");
        out.append("Tokens:        ").append(analysis.tokens().size()).append('\n');
        out.append("Complexity:    ").append(m.complexity()).append("/100\n");
        out.append("Max nesting:   ").append(m.maxNestingDepth()).append('\n');
        out.append('\n');
        out.append("Functions:     ").append(m.functionCount()).append('\n');
        out.append("Classes:       ").append(m.classCount()).append('\n');
        out.append("Loops:         ").append(m.loopCount()).append('\n');
        out.append("Conditionals:  ").append(m.conditionalCount()).append('\n');
        out.append("Variables:     ").append(m.variableCount()).append('\n');
        out.append("Imports:       ").append(m.importCount()).append('\n');
        out.append("Errors:        ").append(m.errorCount()).append('\n');
        if (!analysis.structures().isEmpty()) {
            out.append("\nStructure:\n");
            appendStructures(out, analysis.structures(), 1);
        }
        return out.toString();
    }

    private static void appendStructures(StringBuilder out, List<CodeStructure> structures, int indent) {
        for (CodeStructure structure : structures) {
            out.append("  ".repeat(indent))
                    .append(structure.kind().name().toLowerCase(Locale.ROOT)).append(' ')
                    .append(structure.name())
                    .append(" (lines ").append(structure.startLine()).append('-').append(structure.endLine())
                    .append(")\n");
            appendStructures(out, structure.children(), indent + 1);
        }
    }

    public static String composition(Composition composition) {
        StringBuilder out = new StringBuilder();
        out.append(composition.title()).append("\n\n");
        out.append("Tempo:     ").append(composition.tempo()).append(" BPM\n");
        out.append("Key:       ").append(composition.key()).append(' ').append(composition.scale()).append('\n');
        out.append("Time:      ").append(composition.timeSignature().numerator()).append('/')
                .append(composition.timeSignature().denominator()).append('\n');
        out.append("Duration:  ").append(seconds(composition.totalDurationSeconds())).append('\n');
        out.append("Notes:     ").append(composition.noteCount()).append('\n');
        out.append("Hash:      ").append(composition.metadata().codeHash()).append('\n');
        out.append("\nTracks:\n");
        for (Track track : composition.tracks()) {
            out.append("  ").append(track.name()).append(": ").append(track.notes().size()).append(" notes, ")
                    .append(track.waveform()).append('\n');
        }
        out.append('\n').append(composition.metadata().musicalInterpretation()).append('\n');
        return out.toString();
    }

    public static String comparison(CompositionComparison comparison) {
        CompositionComparison.Side a = comparison.a();
        CompositionComparison.Side b = comparison.b();
        StringBuilder out = new StringBuilder();
        out.append("Musical Code Comparison\n\n");
        out.append(String.format(Locale.ROOT, "%-14s %-22s %-22s%n", "Metric", "Code A", "Code B"));
        row(out, "Language", a.language().id(), b.language().id());
        row(out, "Tempo", a.tempo() + " BPM", b.tempo() + " BPM");
        row(out, "Key", a.key() + " " + a.scale(), b.key() + " " + b.scale());
        row(out, "Duration", seconds(a.durationSeconds()), seconds(b.durationSeconds()));
        row(out, "Complexity", a.complexity() + "/100", b.complexity() + "/100");
        row(out, "Total Notes", a.noteCount(), b.noteCount());
        row(out, "Functions", a.functionCount(), b.functionCount());
        row(out, "Loops", a.loopCount(), b.loopCount());
        row(out, "Conditionals", a.conditionalCount(), b.conditionalCount());
        row(out, "Tracks", a.trackCount(), b.trackCount());
        out.append("\nCode A: ").append(a.interpretation()).append('\n');
        out.append("Code B: ").append(b.interpretation()).append('\n');
        out.append('\n').append(comparison.verdict().description()).append('\n');
        return out.toString();
    }

    public static String versionComparison(Composition oldComposition, Composition newComposition) {
        StringBuilder out = new StringBuilder();
        out.append("Version Comparison:\n");
        out.append(String.format(Locale.ROOT, "%-14s %-22s %-22s%n", "Metric", "Old Code", "New Code"));
        row(out, "Tempo", oldComposition.tempo() + " BPM", newComposition.tempo() + " BPM");
        row(out, "Key", oldComposition.key() + " " + oldComposition.scale(),
                newComposition.key() + " " + newComposition.scale());
        row(out, "Complexity", oldComposition.metadata().complexity() + "/100",
                newComposition.metadata().complexity() + "/100");
        row(out, "Duration", seconds(oldComposition.totalDurationSeconds()),
                seconds(newComposition.totalDurationSeconds()));
        return out.toString();
    }

    public static String styles() {
        StringBuilder out = new StringBuilder();
        for (MusicStyle style : MusicStyle.values()) {
            out.append(String.format(Locale.ROOT, "%-11s %-3s %-11s %d-%d BPM, reverb %.1f, waves %s, rhythm %s%n",
                    style.id(), style.baseKey(), style.scale(), style.minBpm(), style.maxBpm(),
                    style.reverbAmount(), joined(style.preferredWaveforms()), joined(style.durationBias())));
        }
        return out.toString();
    }

    private static String joined(List<?> values) {
        return values.stream().map(value -> value.toString().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("/"));
    }

    private static void row(StringBuilder out, String metric, Object a, Object b) {
        out.append(String.format(Locale.ROOT, "%-14s %-22s %-22s%n", metric, a, b));
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.1fs", value);
    }
}
