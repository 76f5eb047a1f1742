package org.codesonify.diff;

/**
 * One classified line of a diff.
 *
 * @param type The classification.
 * @param content The line without its {@code +}/{@code -} marker; header and context lines are kept whole.
 * @param lineNumber The 1-based line number within the diff text.
 */
public record DiffLine(DiffLineType type, String content, int lineNumber) {}
