package org.codesonify.composition;

/**
 * A short, stable fingerprint of an input text.
 */
public final class ContentHash {

    private ContentHash() {}

    /**
     * Hashes text with the 32-bit rolling hash {@code h = h * 31 + c} over its UTF-16 code units
     * and renders the absolute value as at least 8 lowercase hex digits.
     *
     * @param text The text to hash.
     * @return The hash, e.g. {@code "0001e240"}.
     */
    public static String of(String text) {
        int hash = 0;
        for (int i = 0; i < text.length(); i++) {
            hash = (hash << 5) - hash + text.charAt(i);
        }
        String hex = Long.toHexString(Math.abs((long) hash));
        return "0".repeat(Math.max(0, 8 - hex.length())) + hex;
    }
}
