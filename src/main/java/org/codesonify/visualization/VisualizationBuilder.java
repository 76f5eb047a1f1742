package org.codesonify.visualization;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.lexer.Token;
import org.codesonify.analysis.lexer.TokenKind;
import org.codesonify.music.Note;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Derives {@link VisualizationData} from an analysis and the notes generated from it.
 */
public class VisualizationBuilder {

    static final int WAVEFORM_POINTS = 200;
    static final int MAX_FREQUENCY_BANDS = 100;
    private static final double NEARBY_WINDOW = 0.05;

    private static final String FALLBACK_COLOR = "#455A64";
    private static final Map<TokenKind, String> COLORS = new EnumMap<>(TokenKind.class);

    static {
        COLORS.put(TokenKind.FUNCTION, "#4FC3F7");
        COLORS.put(TokenKind.LOOP, "#FFB74D");
        COLORS.put(TokenKind.CONDITIONAL, "#81C784");
        COLORS.put(TokenKind.VARIABLE, "#CE93D8");
        COLORS.put(TokenKind.CLASS, "#F06292");
        COLORS.put(TokenKind.STRING, "#A5D6A7");
        COLORS.put(TokenKind.NUMBER, "#FFD54F");
        COLORS.put(TokenKind.OPERATOR, "#90A4AE");
        COLORS.put(TokenKind.COMMENT, "#78909C");
        COLORS.put(TokenKind.IMPORT, "#4DD0E1");
        COLORS.put(TokenKind.RETURN_STMT, "#EF5350");
        COLORS.put(TokenKind.ERROR_MARKER, "#FF1744");
        COLORS.put(TokenKind.BRACKET_OPEN, "#546E7A");
        COLORS.put(TokenKind.BRACKET_CLOSE, "#546E7A");
        COLORS.put(TokenKind.WHITESPACE, "#263238");
        COLORS.put(TokenKind.KEYWORD, "#BA68C8");
        COLORS.put(TokenKind.UNKNOWN, FALLBACK_COLOR);
    }

    /**
     * Builds the visualization data.
     *
     * @param analysis The analysis.
     * @param notes The notes in generation order.
     * @return The data.
     */
    public VisualizationData build(CodeAnalysis analysis, List<Note> notes) {
        return new VisualizationData(waveform(notes), frequencyBands(notes), tokenColors(analysis, notes));
    }

    /**
     * Returns the highlight color of a token kind.
     * @param kind The kind.
     * @return The color as {@code #RRGGBB}.
     */
    public static String colorOf(TokenKind kind) {
        return COLORS.getOrDefault(kind, FALLBACK_COLOR);
    }

    // Note density around each sample point drives both the amplitude and the phase.
    List<Double> waveform(List<Note> notes) {
        double span = notes.isEmpty() ? 1 : notes.get(notes.size() - 1).startTime() + 1;
        double[] normalized = notes.stream().mapToDouble(note -> note.startTime() / span).toArray();

        List<Double> points = new ArrayList<>(WAVEFORM_POINTS);
        for (int i = 0; i < WAVEFORM_POINTS; i++) {
            double t = (double) i / WAVEFORM_POINTS;
            int nearby = 0;
            for (double time : normalized) {
                if (Math.abs(time - t) < NEARBY_WINDOW) nearby++;
            }
            double amplitude = Math.min(1, nearby * 0.2);
            points.add(amplitude * Math.sin(t * Math.PI * 8 + nearby));
        }
        return points;
    }

    List<FrequencyBand> frequencyBands(List<Note> notes) {
        return notes.stream()
                .limit(MAX_FREQUENCY_BANDS)
                .map(note -> new FrequencyBand(note.pitch().frequency(), note.velocity(), note.startTime()))
                .collect(Collectors.toList());
    }

    List<TokenColor> tokenColors(CodeAnalysis analysis, List<Note> notes) {
        List<TokenColor> colors = new ArrayList<>();
        int index = 0;
        for (Token token : analysis.tokens()) {
            if (token.kind() == TokenKind.WHITESPACE) {
                continue;
            }
            colors.add(new TokenColor(token, colorOf(token.kind()), Math.min(index, notes.size() - 1)));
            index++;
        }
        return colors;
    }
}
