package org.codesonify.visualization;

import org.codesonify.analysis.lexer.Token;

/**
 * A token with its highlight color and the note it is linked to.
 *
 * @param token The token.
 * @param color The color as {@code #RRGGBB}.
 * @param noteIndex Index into the generated notes; -1 when there are none.
 */
public record TokenColor(Token token, String color, int noteIndex) {}
