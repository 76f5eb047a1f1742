package org.codesonify.music;

import java.util.List;

/**
 * The fixed parameters of the code-to-music rules.
 *
 * @param loopPattern Durations of one repetition of a loop pattern.
 * @param ifChord Chord played for {@code if} and other branches.
 * @param elseChord Chord played for {@code else} and {@code elif}.
 * @param bassOctave Octave of variable bass notes.
 * @param minBpm Tempo at complexity 0.
 * @param maxBpm Tempo at complexity 100.
 * @param depthBaseOctave Octave at nesting depth 0.
 * @param maxOctaveShift Largest octave shift nesting can cause.
 * @param dissonanceIntervals Intervals of the error cluster above the key root.
 */
public record MappingConfig(
        List<Duration> loopPattern,
        List<NoteName> ifChord,
        List<NoteName> elseChord,
        int bassOctave,
        int minBpm,
        int maxBpm,
        int depthBaseOctave,
        int maxOctaveShift,
        List<Integer> dissonanceIntervals
) {
    /** The mapping every sonification uses. */
    public static final MappingConfig DEFAULT = new MappingConfig(
            List.of(Duration.EIGHTH, Duration.EIGHTH, Duration.SIXTEENTH, Duration.SIXTEENTH, Duration.EIGHTH),
            List.of(NoteName.C, NoteName.E, NoteName.G),
            List.of(NoteName.A, NoteName.C, NoteName.E),
            2,
            70,
            160,
            4,
            2,
            List.of(1, 6, 11));

    public MappingConfig {
        loopPattern = List.copyOf(loopPattern);
        ifChord = List.copyOf(ifChord);
        elseChord = List.copyOf(elseChord);
        dissonanceIntervals = List.copyOf(dissonanceIntervals);
    }

    /**
     * Maps a nesting depth to an octave: {@code clamp(1, 7, base + min(depth, maxShift))}.
     * @param depth The nesting depth.
     * @return The octave.
     */
    public int octaveForDepth(int depth) {
        int shift = Math.min(depth, maxOctaveShift);
        return Math.min(7, Math.max(1, depthBaseOctave + shift));
    }
}
