package org.codesonify.api;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.Language;
import org.codesonify.composition.Composition;
import org.codesonify.diff.DiffSonification;
import org.codesonify.diff.VersionPairSonification;
import org.codesonify.music.MusicStyle;

/**
 * Defines the public interface for turning code into music.
 * <p>
 * Language hints and styles may be {@code null}: a missing hint means the language is detected,
 * a missing style means the implementation's default style. Text arguments must not be {@code null}.
 * Every operation is deterministic, so equal arguments produce equal results.
 */
public interface ISonifier {

    /**
     * Analyzes source text.
     * @param source The source text.
     * @param languageHint The language to report, or {@code null} to detect it.
     * @return The analysis.
     * @throws SonificationException if {@code source} is null.
     */
    CodeAnalysis analyzeCode(String source, Language languageHint);

    /**
     * Composes a piece from source text.
     * @param source The source text.
     * @param languageHint The language to report, or {@code null} to detect it.
     * @param style The style, or {@code null} for the default.
     * @return The composition.
     * @throws SonificationException if {@code source} is null.
     */
    Composition sonifyCode(String source, Language languageHint, MusicStyle style);

    /**
     * Composes a piece from source text and derives drawing data from it.
     * @param source The source text.
     * @param languageHint The language to report, or {@code null} to detect it.
     * @param style The style, or {@code null} for the default.
     * @return The composition together with its analysis and visualization data.
     * @throws SonificationException if {@code source} is null.
     */
    SonificationResult sonifyWithVisualization(String source, Language languageHint, MusicStyle style);

    /**
     * Composes a piece from unified-diff text.
     * @param diffText The diff.
     * @param style The style, or {@code null} for the default.
     * @return The composition with the diff statistics and a summary.
     * @throws SonificationException if {@code diffText} is null.
     */
    DiffSonification sonifyDiff(String diffText, MusicStyle style);

    /**
     * Composes pieces from two versions of a text.
     * @param oldText The old version.
     * @param newText The new version.
     * @param style The style, or {@code null} for the default.
     * @return The diff sonification and the compositions of both versions.
     * @throws SonificationException if either text is null.
     */
    VersionPairSonification sonifyVersions(String oldText, String newText, MusicStyle style);

    /**
     * Composes both inputs and compares the results.
     * @param sourceA The first source text.
     * @param sourceB The second source text.
     * @param style The style, or {@code null} for the default.
     * @return The comparison.
     * @throws SonificationException if either text is null.
     */
    CompositionComparison compare(String sourceA, String sourceB, MusicStyle style);

    /**
     * Encodes a composition as a Standard MIDI File.
     * @param composition The composition.
     * @return The file bytes.
     * @throws SonificationException if {@code composition} is null.
     */
    byte[] encodeToBinary(Composition composition);

    /**
     * Encodes a composition as a Standard MIDI File in Base64.
     * @param composition The composition.
     * @return The Base64 text.
     * @throws SonificationException if {@code composition} is null.
     */
    String encodeToBase64(Composition composition);

    /**
     * Composes a piece from unified-diff text.
     * @param diffText The diff.
     * @param style The style, or {@code null} for the default.
     * @return The composition.
     */
    default Composition sonifyDiffText(String diffText, MusicStyle style) {
        return sonifyDiff(diffText, style).composition();
    }

    /**
     * Composes the diff piece of two versions of a text.
     * @param oldText The old version.
     * @param newText The new version.
     * @param style The style, or {@code null} for the default.
     * @return The composition of the synthesized diff.
     */
    default Composition sonifyVersionPair(String oldText, String newText, MusicStyle style) {
        return sonifyVersions(oldText, newText, style).composition();
    }

    default CodeAnalysis analyzeCode(String source) {
        return analyzeCode(source, null);
    }

    default Composition sonifyCode(String source) {
        return sonifyCode(source, null, null);
    }
}
