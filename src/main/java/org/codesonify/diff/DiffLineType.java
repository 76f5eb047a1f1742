package org.codesonify.diff;

/**
 * Classification of a unified-diff line by its leading characters.
 */
public enum DiffLineType {
    /** {@code +++}, {@code ---}, {@code diff }, {@code index } and {@code @@} lines. */
    HEADER,
    /** Lines starting with {@code +}. */
    ADDED,
    /** Lines starting with {@code -}. */
    REMOVED,
    /** Everything else. */
    CONTEXT
}
