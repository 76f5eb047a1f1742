package org.codesonify.music;

import java.util.List;

/**
 * The notes one mapping rule emits, together with the position of the time cursor after them.
 *
 * @param notes The emitted notes, possibly empty.
 * @param endTime The cursor position in seconds once the rule has run.
 */
public record Phrase(List<Note> notes, double endTime) {

    public Phrase {
        notes = List.copyOf(notes);
    }

    /**
     * A phrase that emits nothing and leaves the cursor at {@code endTime}.
     * @param endTime The cursor position.
     * @return The silent phrase.
     */
    public static Phrase silence(double endTime) {
        return new Phrase(List.of(), endTime);
    }
}
