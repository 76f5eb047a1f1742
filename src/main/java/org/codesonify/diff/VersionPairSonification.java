package org.codesonify.diff;

import org.codesonify.composition.Composition;

/**
 * The result of sonifying two versions of a text.
 *
 * @param diff The sonification of the synthesized diff between the versions.
 * @param oldComposition The code composition of the old version.
 * @param newComposition The code composition of the new version.
 */
public record VersionPairSonification(
        DiffSonification diff,
        Composition oldComposition,
        Composition newComposition
) {

    /** @return The diff composition. */
    public Composition composition() {
        return diff.composition();
    }
}
