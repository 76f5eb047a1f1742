package org.codesonify.composition;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.Language;
import org.codesonify.music.Instrument;
import org.codesonify.music.MusicStyle;
import org.codesonify.music.Note;
import org.codesonify.music.NoteName;
import org.codesonify.music.ScaleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups notes into tracks and wraps them with header data.
 * <p>
 * Tracks appear in the order their instrument is first seen among the notes, and each track keeps the
 * relative order of its notes. The assembler is stateless.
 */
public class CompositionAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionAssembler.class);

    /** Duration reported for a composition without notes. */
    public static final double EMPTY_DURATION_SECONDS = 5.0;

    private static final Map<Language, KeySignature> LANGUAGE_KEYS = new EnumMap<>(Language.class);

    static {
        LANGUAGE_KEYS.put(Language.JAVASCRIPT, new KeySignature(NoteName.C, ScaleType.MIXOLYDIAN));
        LANGUAGE_KEYS.put(Language.TYPESCRIPT, new KeySignature(NoteName.D, ScaleType.MAJOR));
        LANGUAGE_KEYS.put(Language.PYTHON, new KeySignature(NoteName.F, ScaleType.PENTATONIC));
        LANGUAGE_KEYS.put(Language.JAVA, new KeySignature(NoteName.G, ScaleType.MINOR));
        LANGUAGE_KEYS.put(Language.CSHARP, new KeySignature(NoteName.E, ScaleType.LYDIAN));
        LANGUAGE_KEYS.put(Language.GO, new KeySignature(NoteName.A, ScaleType.DORIAN));
        LANGUAGE_KEYS.put(Language.RUST, new KeySignature(NoteName.B, ScaleType.BLUES));
        LANGUAGE_KEYS.put(Language.UNKNOWN, new KeySignature(NoteName.C, ScaleType.MAJOR));
    }

    /**
     * Header data of a composition that does not depend on its notes.
     *
     * @param title The title.
     * @param tempo Tempo in BPM.
     * @param key The key signature to report.
     * @param metadata Descriptive data about the input.
     */
    public record Header(String title, int tempo, KeySignature key, CompositionMetadata metadata) {}

    /**
     * A key root together with its scale.
     *
     * @param root The root.
     * @param scale The scale.
     */
    public record KeySignature(NoteName root, ScaleType scale) {}

    /**
     * Returns the key reported for compositions of a language.
     * @param language The language.
     * @return The key signature; C major for unknown sources.
     */
    public static KeySignature keyFor(Language language) {
        return LANGUAGE_KEYS.getOrDefault(language, LANGUAGE_KEYS.get(Language.UNKNOWN));
    }

    /**
     * Assembles the composition of an analyzed source text.
     *
     * @param source The source text, used for the content hash.
     * @param analysis The analysis of {@code source}.
     * @param notes The notes mapped from the analysis.
     * @param style The style the notes were mapped in.
     * @param tempo The tempo the notes were mapped at.
     * @return The composition.
     */
    public Composition assembleCode(String source, CodeAnalysis analysis, List<Note> notes, MusicStyle style, int tempo) {
        CompositionMetadata metadata = new CompositionMetadata(
                analysis.language(),
                analysis.metrics().totalLines(),
                analysis.metrics().complexity(),
                ContentHash.of(source),
                Interpretations.describe(analysis, style));
        Header header = new Header(
                "CodeSonify: " + analysis.language().id() + " composition",
                tempo,
                keyFor(analysis.language()),
                metadata);
        return assemble(header, notes, TrackLayout.CODE);
    }

    /**
     * Assembles a composition from header data and notes.
     *
     * @param header The header data.
     * @param notes The notes in generation order.
     * @param layout The instrument table that names and configures the tracks.
     * @return The composition.
     */
    public Composition assemble(Header header, List<Note> notes, TrackLayout layout) {
        List<Track> tracks = groupIntoTracks(notes, layout);
        Composition composition = new Composition(
                header.title(),
                header.tempo(),
                TimeSignature.COMMON,
                header.key().root(),
                header.key().scale(),
                totalDuration(notes),
                tracks,
                header.metadata());
        LOG.debug("Assembled '{}': {} tracks, {} notes, {}s", composition.title(), tracks.size(),
                notes.size(), composition.totalDurationSeconds());
        return composition;
    }

    /**
     * Groups notes by instrument.
     *
     * @param notes The notes in generation order.
     * @param layout The instrument table.
     * @return One track per instrument with at least one note, in order of first appearance. Empty without
     *         notes; the encoder always adds the tempo track, so the MIDI file still has a track.
     */
    public List<Track> groupIntoTracks(List<Note> notes, TrackLayout layout) {
        Map<Instrument, List<Note>> byInstrument = new LinkedHashMap<>();
        for (Note note : notes) {
            byInstrument.computeIfAbsent(note.instrument(), instrument -> new ArrayList<>()).add(note);
        }

        List<Track> tracks = new ArrayList<>();
        for (Map.Entry<Instrument, List<Note>> entry : byInstrument.entrySet()) {
            InstrumentProfile profile = layout.profileFor(entry.getKey());
            tracks.add(new Track(profile.trackName(), entry.getKey(), profile.waveform(), profile.volume(),
                    entry.getValue(), profile.effects()));
        }
        return tracks;
    }

    /**
     * Computes the length of a piece: the latest note start plus one second.
     * @param notes The notes.
     * @return The length in seconds, {@value #EMPTY_DURATION_SECONDS} without notes.
     */
    public static double totalDuration(List<Note> notes) {
        if (notes.isEmpty()) {
            return EMPTY_DURATION_SECONDS;
        }
        double latest = notes.stream().mapToDouble(Note::startTime).max().orElse(0);
        return latest + 1;
    }
}
