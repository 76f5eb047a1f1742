package org.codesonify.music;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts a token stream into a time-ordered sequence of notes.
 * <p>
 * Every token kind has one rule. A rule is a pure function of the token, the cursor position and the
 * style; it returns a {@link Phrase} carrying its notes and the new cursor position. The mapper folds
 * the rules over the tokens in source order, so the only state of a run is the cursor threaded through
 * that fold. Instances are immutable and may be shared between threads.
 * <p>
 * All durations are converted to seconds relative to a 120 BPM reference, scaled by
 * {@code 120 / tempo}.
 */
public class MusicMapper {

    private static final Logger LOG = LoggerFactory.getLogger(MusicMapper.class);

    private static final double REFERENCE_BPM = 120.0;

    private static final Map<String, Pitch> OPERATOR_PITCHES = Map.ofEntries(
            Map.entry("=", new Pitch(NoteName.C, 3)), Map.entry("+", new Pitch(NoteName.D, 3)),
            Map.entry("-", new Pitch(NoteName.E, 3)), Map.entry("*", new Pitch(NoteName.F, 3)),
            Map.entry("/", new Pitch(NoteName.G, 3)), Map.entry("%", new Pitch(NoteName.A, 3)),
            Map.entry("!", new Pitch(NoteName.B, 3)), Map.entry("&", new Pitch(NoteName.C, 4)),
            Map.entry("|", new Pitch(NoteName.D, 4)), Map.entry("^", new Pitch(NoteName.E, 4)),
            Map.entry("<", new Pitch(NoteName.F, 4)), Map.entry(">", new Pitch(NoteName.G, 4)),
            Map.entry("?", new Pitch(NoteName.A, 4)));
    private static final Pitch DEFAULT_OPERATOR_PITCH = new Pitch(NoteName.C, 3);

    private final MappingConfig config;

    public MusicMapper() {
        this(MappingConfig.DEFAULT);
    }

    public MusicMapper(MappingConfig config) {
        this.config = config;
    }

    /**
     * Maps an analysis to notes.
     *
     * @param analysis The code analysis.
     * @param style The style preset whose key and scale the phrases are written in.
     * @return The notes in generation order.
     */
    public List<Note> mapToNotes(CodeAnalysis analysis, MusicStyle style) {
        int tempo = tempoFromComplexity(analysis.metrics().complexity());
        Context context = new Context(style, REFERENCE_BPM / tempo);

        List<Note> notes = new ArrayList<>();
        double cursor = 0;
        for (Token token : analysis.tokens()) {
            Phrase phrase = mapToken(token, cursor, context);
            notes.addAll(phrase.notes());
            cursor = phrase.endTime();
        }

        LOG.debug("Mapped {} tokens to {} notes at {} BPM ({} style), cursor ends at {}s",
                analysis.tokens().size(), notes.size(), tempo, style, cursor);
        return notes;
    }

    /**
     * Derives the tempo from a complexity score by linear interpolation over the configured range.
     * @param complexity The complexity score, 0..100.
     * @return The tempo in BPM, rounded to the nearest integer.
     */
    public int tempoFromComplexity(int complexity) {
        int range = config.maxBpm() - config.minBpm();
        return (int) Math.round(config.minBpm() + (complexity / 100.0) * range);
    }

    /**
     * Applies the rule for a single token.
     *
     * @param token The token.
     * @param start The cursor position before the token.
     * @param context The style and tempo scaling of the current run.
     * @return The token's phrase.
     */
    Phrase mapToken(Token token, double start, Context context) {
        return switch (token.kind()) {
            case FUNCTION -> function(token, start, context);
            case LOOP -> loop(token, start, context);
            case CONDITIONAL -> conditional(token, start, context);
            case VARIABLE -> variable(token, start, context);
            case CLASS -> classDeclaration(token, start, context);
            case STRING -> string(token, start, context);
            case NUMBER -> number(token, start, context);
            case OPERATOR -> operator(token, start, context);
            case COMMENT -> comment(token, start, context);
            case IMPORT -> importStatement(start, context);
            case RETURN_STMT -> returnStatement(start, context);
            case ERROR_MARKER -> error(start, context);
            case BRACKET_OPEN -> bracketOpen(token, start, context);
            case BRACKET_CLOSE -> bracketClose(token, start, context);
            case WHITESPACE -> Phrase.silence(start + context.seconds(Duration.EIGHTH) * 0.3);
            case KEYWORD, UNKNOWN -> background(token, start, context);
        };
    }

    // Functions: an ascending phrase of 3 to 5 notes in the style's scale.
    private Phrase function(Token token, double start, Context context) {
        List<Note> notes = new ArrayList<>();
        ScaleType scale = context.style().scale();
        int octave = config.octaveForDepth(token.nestingDepth());
        int length = 3 + token.text().length() % 3;

        double time = start;
        for (int i = 0; i < length; i++) {
            Pitch pitch = Pitch.above(context.style().baseKey(), scale.interval(i), octave);
            notes.add(new Note(pitch, Duration.EIGHTH, 0.7 + i * 0.05, time, Instrument.MELODY));
            time += context.seconds(Duration.EIGHTH);
        }
        return new Phrase(notes, time);
    }

    // Loops: the percussive pattern, repeated twice for "for" and three times for "while".
    private Phrase loop(Token token, double start, Context context) {
        List<Note> notes = new ArrayList<>();
        Pitch pitch = new Pitch(context.style().baseKey(), config.octaveForDepth(token.nestingDepth()));
        int repetitions = switch (token.text()) {
            case "for" -> 2;
            case "while" -> 3;
            default -> 1;
        };

        double time = start;
        for (int r = 0; r < repetitions; r++) {
            for (Duration duration : config.loopPattern()) {
                notes.add(new Note(pitch, duration, 0.6 + r * 0.1, time, Instrument.PERCUSSION));
                time += context.seconds(duration) * 0.5;
            }
        }
        return new Phrase(notes, time);
    }

    // Conditionals: a chord, major-flavored for branches and minor-flavored for else/elif.
    private Phrase conditional(Token token, double start, Context context) {
        int octave = config.octaveForDepth(token.nestingDepth());
        boolean alternative = token.text().equals("else") || token.text().equals("elif");
        List<NoteName> chord = alternative ? config.elseChord() : config.ifChord();

        List<Note> notes = new ArrayList<>();
        for (NoteName name : chord) {
            notes.add(new Note(new Pitch(name, octave), Duration.QUARTER, 0.5, start, Instrument.HARMONY));
        }
        return new Phrase(notes, start + context.seconds(Duration.QUARTER));
    }

    // Variables: one sustained bass note named after the first character.
    private Phrase variable(Token token, double start, Context context) {
        int charCode = token.text().isEmpty() ? 'C' : token.text().charAt(0);
        Pitch pitch = new Pitch(NoteName.fromSemitone(charCode % 12), config.bassOctave());
        Note note = new Note(pitch, Duration.HALF, 0.4, start, Instrument.BASS);
        return new Phrase(List.of(note), start + context.seconds(Duration.QUARTER));
    }

    // Classes: a power chord of root, fifth and octave.
    private Phrase classDeclaration(Token token, double start, Context context) {
        int octave = config.octaveForDepth(token.nestingDepth());
        List<Note> notes = new ArrayList<>();
        for (int interval : new int[]{0, 7, 12}) {
            Pitch pitch = Pitch.above(context.style().baseKey(), interval, octave);
            notes.add(new Note(pitch, Duration.HALF, 0.65, start, Instrument.MELODY));
        }
        return new Phrase(notes, start + context.seconds(Duration.HALF));
    }

    // Strings: a soft pentatonic note picked by the string length.
    private Phrase string(Token token, double start, Context context) {
        ScaleType scale = ScaleType.PENTATONIC;
        int degree = token.text().length() % scale.size();
        Pitch pitch = new Pitch(NoteName.fromSemitone(context.style().baseKey().semitone() + scale.interval(degree)), 5);
        Note note = new Note(pitch, Duration.QUARTER, 0.35, start, Instrument.AMBIENT);
        return new Phrase(List.of(note), start + context.seconds(Duration.EIGHTH));
    }

    // Numbers: a staccato note, pitch class from the value and octave from its magnitude.
    private Phrase number(Token token, double start, Context context) {
        double value = parseNumber(token.text());
        int pitchClass = (int) (Math.abs(Math.round(value)) % 12);
        int octave = (int) Math.min(7, Math.max(2, 3 + Math.floor(value / 100)));
        Note note = new Note(new Pitch(NoteName.fromSemitone(pitchClass), octave),
                Duration.SIXTEENTH, 0.5, start, Instrument.MELODY);
        return new Phrase(List.of(note), start + context.seconds(Duration.SIXTEENTH));
    }

    private Phrase operator(Token token, double start, Context context) {
        Pitch pitch = OPERATOR_PITCHES.getOrDefault(token.text(), DEFAULT_OPERATOR_PITCH);
        Note note = new Note(pitch, Duration.SIXTEENTH, 0.3, start, Instrument.PERCUSSION);
        return new Phrase(List.of(note), start + context.seconds(Duration.SIXTEENTH) * 0.5);
    }

    // Comments: a quiet ambient pad picked by the line number.
    private Phrase comment(Token token, double start, Context context) {
        ScaleType scale = ScaleType.PENTATONIC;
        int degree = token.line() % scale.size();
        Pitch pitch = new Pitch(NoteName.fromSemitone(context.style().baseKey().semitone() + scale.interval(degree)), 5);
        Note note = new Note(pitch, Duration.HALF, 0.15, start, Instrument.AMBIENT);
        return new Phrase(List.of(note), start + context.seconds(Duration.QUARTER));
    }

    // Imports: a rising arpeggio over three octaves.
    private Phrase importStatement(double start, Context context) {
        ScaleType scale = context.style().scale();
        List<Note> notes = new ArrayList<>();
        double time = start;
        for (int i = 0; i < 3; i++) {
            NoteName name = NoteName.fromSemitone(context.style().baseKey().semitone() + scale.interval(i));
            notes.add(new Note(new Pitch(name, 4 + i), Duration.SIXTEENTH, 0.3, time, Instrument.AMBIENT));
            time += context.seconds(Duration.SIXTEENTH);
        }
        return new Phrase(notes, time);
    }

    // Returns: the major third falling to the root.
    private Phrase returnStatement(double start, Context context) {
        NoteName root = context.style().baseKey();
        Note third = new Note(new Pitch(NoteName.fromSemitone(root.semitone() + 4), 4),
                Duration.EIGHTH, 0.5, start, Instrument.MELODY);
        double time = start + context.seconds(Duration.EIGHTH);
        Note resolution = new Note(new Pitch(root, 4), Duration.QUARTER, 0.6, time, Instrument.MELODY);
        return new Phrase(List.of(third, resolution), time + context.seconds(Duration.QUARTER));
    }

    private Phrase error(double start, Context context) {
        List<Note> notes = new ArrayList<>();
        for (int interval : config.dissonanceIntervals()) {
            NoteName name = NoteName.fromSemitone(context.style().baseKey().semitone() + interval);
            notes.add(new Note(new Pitch(name, 3), Duration.EIGHTH, 0.8, start, Instrument.DISSONANCE));
        }
        return new Phrase(notes, start + context.seconds(Duration.EIGHTH));
    }

    // Brackets are grace notes and never move the cursor.
    private Phrase bracketOpen(Token token, double start, Context context) {
        Pitch pitch = new Pitch(context.style().baseKey(), config.octaveForDepth(token.nestingDepth()));
        return new Phrase(List.of(new Note(pitch, Duration.SIXTEENTH, 0.2, start, Instrument.AMBIENT)), start);
    }

    private Phrase bracketClose(Token token, double start, Context context) {
        int octave = Math.max(2, config.octaveForDepth(token.nestingDepth()) - 1);
        Pitch pitch = new Pitch(context.style().baseKey(), octave);
        return new Phrase(List.of(new Note(pitch, Duration.SIXTEENTH, 0.2, start, Instrument.AMBIENT)), start);
    }

    private Phrase background(Token token, double start, Context context) {
        int pitchClass = token.text().isEmpty() ? 0 : token.text().charAt(0) % 12;
        Pitch pitch = new Pitch(NoteName.fromSemitone(pitchClass), config.octaveForDepth(token.nestingDepth()));
        Note note = new Note(pitch, Duration.SIXTEENTH, 0.15, start, Instrument.AMBIENT);
        return new Phrase(List.of(note), start + context.seconds(Duration.SIXTEENTH) * 0.3);
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * The per-run parameters every rule reads.
     *
     * @param style The style preset.
     * @param tempoMultiplier {@code 120 / tempo}.
     */
    record Context(MusicStyle style, double tempoMultiplier) {

        double seconds(Duration duration) {
            return duration.referenceSeconds() * tempoMultiplier;
        }
    }
}
