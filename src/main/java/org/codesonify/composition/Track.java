package org.codesonify.composition;

import org.codesonify.music.Instrument;
import org.codesonify.music.Note;
import org.codesonify.music.Waveform;

import java.util.List;

/**
 * All notes of one instrument, with the sound settings for that instrument.
 *
 * @param name Display name of the track.
 * @param instrument The single instrument every note of the track belongs to.
 * @param waveform Suggested oscillator shape.
 * @param volume Track volume in [0, 1].
 * @param notes The notes in insertion order.
 * @param effects The effect chain in order.
 */
public record Track(
        String name,
        Instrument instrument,
        Waveform waveform,
        double volume,
        List<Note> notes,
        List<TrackEffect> effects
) {
    public Track {
        notes = List.copyOf(notes);
        effects = List.copyOf(effects);
    }
}
