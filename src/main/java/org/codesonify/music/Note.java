package org.codesonify.music;

/**
 * A single musical event.
 *
 * @param pitch The pitch.
 * @param duration The symbolic duration.
 * @param velocity The loudness in [0, 1]; values outside are clamped.
 * @param startTime The start time in seconds from the beginning of the composition.
 * @param instrument The voice that plays the note.
 */
public record Note(
        Pitch pitch,
        Duration duration,
        double velocity,
        double startTime,
        Instrument instrument
) {
    public Note {
        velocity = Math.max(0.0, Math.min(1.0, velocity));
    }
}
