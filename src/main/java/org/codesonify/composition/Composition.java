package org.codesonify.composition;

import org.codesonify.music.NoteName;
import org.codesonify.music.ScaleType;

import java.util.List;

/**
 * A complete piece: header data plus one track per instrument that received notes.
 * A composition is never modified after it has been assembled.
 *
 * @param title The title.
 * @param tempo Tempo in beats per minute.
 * @param timeSignature The time signature.
 * @param key The reported key.
 * @param scale The reported scale.
 * @param totalDurationSeconds Length of the piece in seconds.
 * @param tracks The tracks in order of first appearance of their instrument.
 * @param metadata Descriptive data about the input.
 */
public record Composition(
        String title,
        int tempo,
        TimeSignature timeSignature,
        NoteName key,
        ScaleType scale,
        double totalDurationSeconds,
        List<Track> tracks,
        CompositionMetadata metadata
) {
    public Composition {
        tracks = List.copyOf(tracks);
    }

    /**
     * Counts the notes over all tracks.
     * @return The total number of notes.
     */
    public int noteCount() {
        return tracks.stream().mapToInt(track -> track.notes().size()).sum();
    }
}
