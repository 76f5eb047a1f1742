package org.codesonify.diff;

import org.codesonify.composition.Composition;

/**
 * The result of sonifying a diff.
 *
 * @param composition The composition.
 * @param diffStats The statistics the composition was derived from.
 * @param summary A multi-line plain-text explanation of the piece.
 */
public record DiffSonification(Composition composition, DiffStats diffStats, String summary) {}
