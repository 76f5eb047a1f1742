package org.codesonify.music;

/**
 * A pitch class in a given octave, in scientific pitch notation ({@code C4} is middle C).
 *
 * @param name The pitch class.
 * @param octave The octave number.
 */
public record Pitch(NoteName name, int octave) {

    /**
     * Builds the pitch that lies {@code interval} semitones above the root of a key,
     * carrying into the next octave when the sum passes B.
     *
     * @param key The root of the key.
     * @param interval The semitone offset above the root.
     * @param octave The octave of the root.
     * @return The resulting pitch.
     */
    public static Pitch above(NoteName key, int interval, int octave) {
        int absolute = key.semitone() + interval;
        return new Pitch(NoteName.fromSemitone(absolute), octave + Math.floorDiv(absolute, 12));
    }

    /**
     * Returns the MIDI note number of this pitch, where {@code C4} is 60.
     * The result may lie outside the valid MIDI range 0..127.
     * @return The note number.
     */
    public int midiNumber() {
        return (octave + 1) * 12 + name.semitone();
    }

    /**
     * Returns the frequency in Hz under twelve-tone equal temperament with A4 = 440 Hz.
     * @return The frequency.
     */
    public double frequency() {
        return 440.0 * Math.pow(2, (midiNumber() - 69) / 12.0);
    }

    @Override
    public String toString() {
        return name.symbol() + octave;
    }
}
