package org.codesonify.analysis;

import java.util.regex.Pattern;

/**
 * Guesses the language of a source text by counting how many signatures of each language match it.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    /**
     * Detects the language of the given text.
     * The language with the most matching signatures wins; ties go to the language declared first
     * in {@link Language}. No match at all yields {@link Language#UNKNOWN}.
     *
     * @param source The source text.
     * @return The detected language, never {@code null}.
     */
    public static Language detect(String source) {
        Language best = Language.UNKNOWN;
        int bestScore = 0;
        for (Language language : Language.values()) {
            int score = 0;
            for (Pattern signature : language.signatures()) {
                if (signature.matcher(source).find()) {
                    score++;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = language;
            }
        }
        return best;
    }
}
