package org.codesonify.diff;

import org.codesonify.analysis.Language;
import org.codesonify.composition.Composer;
import org.codesonify.composition.Composition;
import org.codesonify.composition.CompositionAssembler;
import org.codesonify.composition.CompositionAssembler.KeySignature;
import org.codesonify.composition.CompositionMetadata;
import org.codesonify.composition.ContentHash;
import org.codesonify.composition.TrackLayout;
import org.codesonify.music.MusicStyle;
import org.codesonify.music.Note;
import org.codesonify.music.NoteName;
import org.codesonify.music.ScaleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns code changes into music.
 * <p>
 * The mood of the piece follows the share of added lines: mostly additions play in C major,
 * mostly removals in A minor and anything in between in D dorian. The tempo rises with the
 * number of changed lines.
 */
public class DiffSonifier {

    private static final Logger LOG = LoggerFactory.getLogger(DiffSonifier.class);

    static final KeySignature BRIGHT = new KeySignature(NoteName.C, ScaleType.MAJOR);
    static final KeySignature DARK = new KeySignature(NoteName.A, ScaleType.MINOR);
    static final KeySignature BALANCED = new KeySignature(NoteName.D, ScaleType.DORIAN);

    private static final int MIN_TEMPO = 70;
    private static final int MAX_TEMPO = 160;

    private final Composer composer;
    private final DiffMapper mapper;
    private final CompositionAssembler assembler;

    public DiffSonifier() {
        this(new Composer(), new DiffMapper(), new CompositionAssembler());
    }

    public DiffSonifier(Composer composer, DiffMapper mapper, CompositionAssembler assembler) {
        this.composer = composer;
        this.mapper = mapper;
        this.assembler = assembler;
    }

    /**
     * Sonifies unified-diff text.
     *
     * @param diffText The diff.
     * @param style The style named in the interpretation.
     * @return The composition, the diff statistics and a plain-text summary.
     */
    public DiffSonification sonifyDiff(String diffText, MusicStyle style) {
        List<DiffLine> lines = DiffParser.parse(diffText);
        DiffStats stats = DiffParser.analyze(lines);

        KeySignature key = keyFor(stats.changeRatio());
        int tempo = tempoFor(stats.totalChanges());
        List<Note> notes = mapper.mapToNotes(lines, key.root(), tempo);

        CompositionMetadata metadata = new CompositionMetadata(
                Language.UNKNOWN,
                lines.size(),
                Math.min(100, stats.totalChanges() * 3),
                ContentHash.of(diffText),
                interpret(stats, style));
        CompositionAssembler.Header header = new CompositionAssembler.Header(
                "CodeSonify: Diff Composition (" + stats.addedLines() + "+ / " + stats.removedLines() + "-)",
                tempo, key, metadata);
        Composition composition = assembler.assemble(header, notes, TrackLayout.DIFF);

        LOG.debug("Sonified diff: +{} -{} ({} files), {} {} at {} BPM", stats.addedLines(),
                stats.removedLines(), stats.files().size(), key.root(), key.scale(), tempo);
        return new DiffSonification(composition, stats, summarize(stats, composition));
    }

    /**
     * Sonifies two versions of a text: each version on its own, and the line-by-line difference
     * between them.
     *
     * @param oldText The old version.
     * @param newText The new version.
     * @param style The style preset.
     * @return The diff sonification plus the compositions of both versions.
     */
    public VersionPairSonification sonifyTwoVersions(String oldText, String newText, MusicStyle style) {
        Composition oldComposition = composer.compose(oldText, null, style).composition();
        Composition newComposition = composer.compose(newText, null, style).composition();
        DiffSonification diff = sonifyDiff(PseudoDiff.between(oldText, newText), style);
        return new VersionPairSonification(diff, oldComposition, newComposition);
    }

    /**
     * Chooses the key of a diff piece from its change ratio.
     * @param changeRatio The share of added lines among changed lines.
     * @return C major above 0.6, A minor below 0.4, D dorian otherwise.
     */
    public static KeySignature keyFor(double changeRatio) {
        if (changeRatio > 0.6) {
            return BRIGHT;
        }
        if (changeRatio < 0.4) {
            return DARK;
        }
        return BALANCED;
    }

    /**
     * Derives the tempo from the number of changed lines.
     * @param totalChanges Added plus removed lines.
     * @return {@code 80 + 2 * totalChanges}, clamped to 70..160 BPM.
     */
    public static int tempoFor(int totalChanges) {
        return Math.min(MAX_TEMPO, Math.max(MIN_TEMPO, 80 + totalChanges * 2));
    }

    static String interpret(DiffStats stats, MusicStyle style) {
        List<String> parts = new ArrayList<>();
        double ratio = stats.changeRatio();

        if (ratio > 0.8) {
            parts.add("A bright, optimistic composition reflecting significant new code additions");
        } else if (ratio > 0.6) {
            parts.add("A mostly uplifting piece with new code dominating the melody");
        } else if (ratio > 0.4) {
            parts.add("A balanced composition reflecting equal parts creation and removal - a refactoring journey");
        } else if (ratio > 0.2) {
            parts.add("A contemplative piece where code cleanup dominates - simplification in progress");
        } else {
            parts.add("A minimalist, descending composition reflecting major code removal - a bold cleanup");
        }

        parts.add(stats.addedLines() + " lines added, " + stats.removedLines() + " lines removed");

        int files = stats.files().size();
        if (files > 0) {
            parts.add("across " + files + " file" + (files > 1 ? "s" : ""));
        }

        parts.add("rendered in " + style.id() + " style");
        return String.join(", ", parts) + ".";
    }

    static String summarize(DiffStats stats, Composition composition) {
        String mood = stats.changeRatio() > 0.5 ? "bright, more additions" : "dark, more deletions";
        String intensity = stats.totalChanges() > 30 ? "intense" : "moderate";
        return String.join("\n",
                "Diff Sonification Complete",
                "",
                "Changes:",
                "+ " + stats.addedLines() + " lines added  " + "+".repeat(Math.min(20, stats.addedLines())),
                "- " + stats.removedLines() + " lines removed  " + "-".repeat(Math.min(20, stats.removedLines())),
                "",
                "Musical Interpretation:",
                "- Key: " + composition.key() + " " + composition.scale() + " (" + mood + ")",
                "- Tempo: " + composition.tempo() + " BPM (" + intensity + " changes)",
                "- Duration: " + String.format(Locale.ROOT, "%.1f", composition.totalDurationSeconds()) + "s",
                "- Tracks: " + composition.tracks().size(),
                "",
                "How to read it:",
                "- Ascending bright melodies = added code",
                "- Descending dark bass = removed code",
                "- Chords = significant changes",
                "- Soft ambient = unchanged context",
                "",
                composition.metadata().musicalInterpretation());
    }
}
