package org.codesonify.diff;

import org.codesonify.music.Duration;
import org.codesonify.music.Instrument;
import org.codesonify.music.Note;
import org.codesonify.music.NoteName;
import org.codesonify.music.Phrase;
import org.codesonify.music.Pitch;
import org.codesonify.music.ScaleType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts classified diff lines into notes.
 * <p>
 * Additions climb the major scale, removals descend the minor scale, context lines hum on the
 * pentatonic scale and headers tick quietly. Every phrase is written relative to the key root; the
 * scales are fixed and do not follow the reported mode of the piece. Like the code mapper, each line
 * rule returns a {@link Phrase} and the cursor is threaded through a fold over the lines.
 */
public class DiffMapper {

    private static final double REFERENCE_BPM = 120.0;
    private static final int[] MAJOR_TRIAD = {0, 4, 7};

    /**
     * Maps diff lines to notes.
     *
     * @param lines The classified lines.
     * @param key The key root all phrases are built on.
     * @param tempo The tempo of the piece; step sizes scale with {@code 120 / tempo}.
     * @return The notes in generation order.
     */
    public List<Note> mapToNotes(List<DiffLine> lines, NoteName key, int tempo) {
        double multiplier = REFERENCE_BPM / tempo;
        List<Note> notes = new ArrayList<>();
        double cursor = 0;
        for (DiffLine line : lines) {
            Phrase phrase = mapLine(line, cursor, key, multiplier);
            notes.addAll(phrase.notes());
            cursor = phrase.endTime();
        }
        return notes;
    }

    Phrase mapLine(DiffLine line, double start, NoteName key, double multiplier) {
        return switch (line.type()) {
            case HEADER -> header(start, key, multiplier);
            case CONTEXT -> context(line, start, key, multiplier);
            case ADDED -> added(line, start, key, multiplier);
            case REMOVED -> removed(line, start, key, multiplier);
        };
    }

    private Phrase header(double start, NoteName key, double multiplier) {
        Note hit = new Note(new Pitch(key, 5), Duration.SIXTEENTH, 0.2, start, Instrument.AMBIENT);
        return new Phrase(List.of(hit), start + 0.1 * multiplier);
    }

    private Phrase context(DiffLine line, double start, NoteName key, double multiplier) {
        int degree = line.lineNumber() % ScaleType.PENTATONIC.size();
        Pitch pitch = new Pitch(inKey(key, ScaleType.PENTATONIC.interval(degree)), 3);
        Note note = new Note(pitch, Duration.QUARTER, 0.15, start, Instrument.AMBIENT);
        return new Phrase(List.of(note), start + 0.15 * multiplier);
    }

    // One ascending note per ten characters, at most five, and a triad for long lines.
    private Phrase added(DiffLine line, double start, NoteName key, double multiplier) {
        ScaleType scale = ScaleType.MAJOR;
        int length = line.content().strip().length();
        int phraseLength = Math.min(5, Math.max(1, length / 10 + 1));

        List<Note> notes = new ArrayList<>();
        double time = start;
        for (int i = 0; i < phraseLength; i++) {
            int octave = Math.min(6, 4 + i / scale.size());
            Pitch pitch = new Pitch(inKey(key, scale.interval(i)), octave);
            notes.add(new Note(pitch, Duration.EIGHTH, 0.6 + i * 0.05, time, Instrument.MELODY));
            time += 0.12 * multiplier;
        }

        if (length > 20) {
            for (int interval : MAJOR_TRIAD) {
                notes.add(new Note(new Pitch(inKey(key, interval), 4), Duration.QUARTER, 0.35, time,
                        Instrument.HARMONY));
            }
        }
        return new Phrase(notes, time + 0.1 * multiplier);
    }

    // One descending note per twelve characters, at most four, closed by a low percussion hit.
    private Phrase removed(DiffLine line, double start, NoteName key, double multiplier) {
        ScaleType scale = ScaleType.MINOR;
        int length = line.content().strip().length();
        int phraseLength = Math.min(4, Math.max(1, length / 12 + 1));

        List<Note> notes = new ArrayList<>();
        double time = start;
        for (int i = 0; i < phraseLength; i++) {
            int octave = Math.max(2, 4 - i / scale.size());
            Pitch pitch = new Pitch(inKey(key, scale.interval(scale.size() - 1 - i)), octave);
            notes.add(new Note(pitch, Duration.EIGHTH, 0.45 - i * 0.05, time, Instrument.BASS));
            time += 0.15 * multiplier;
        }

        notes.add(new Note(new Pitch(key, 2), Duration.SIXTEENTH, 0.3, time, Instrument.PERCUSSION));
        return new Phrase(notes, time + 0.08 * multiplier);
    }

    private static NoteName inKey(NoteName key, int interval) {
        return NoteName.fromSemitone(key.semitone() + interval);
    }
}
