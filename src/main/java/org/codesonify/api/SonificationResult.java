package org.codesonify.api;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.composition.Composition;
import org.codesonify.visualization.VisualizationData;

/**
 * A code composition together with the analysis it came from and its drawing data.
 *
 * @param composition The composition.
 * @param analysis The code analysis.
 * @param visualization The visualization data.
 */
public record SonificationResult(Composition composition, CodeAnalysis analysis, VisualizationData visualization) {}
