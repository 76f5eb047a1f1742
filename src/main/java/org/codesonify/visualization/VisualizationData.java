package org.codesonify.visualization;

import java.util.List;

/**
 * Data for drawing a sonification.
 *
 * @param waveformPoints Amplitudes in -1..1 sampled at evenly spaced points over the piece.
 * @param frequencyBands The leading notes as frequency points.
 * @param tokenColors The non-whitespace tokens with their colors.
 */
public record VisualizationData(
        List<Double> waveformPoints,
        List<FrequencyBand> frequencyBands,
        List<TokenColor> tokenColors
) {
    public VisualizationData {
        waveformPoints = List.copyOf(waveformPoints);
        frequencyBands = List.copyOf(frequencyBands);
        tokenColors = List.copyOf(tokenColors);
    }
}
