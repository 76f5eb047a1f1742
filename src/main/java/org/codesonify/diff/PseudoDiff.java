package org.codesonify.diff;

/**
 * Builds a unified-diff-shaped text from two versions of a file by pairing lines by index.
 * <p>
 * Equal lines become context, differing lines become a removal followed by an addition, and the
 * unmatched tail of the longer version becomes pure additions or removals. There is no alignment,
 * so an inserted line shifts every later pair.
 */
public final class PseudoDiff {

    static final String HEADER = "--- a/old.code\n+++ b/new.code\n@@ -1 +1 @@\n";

    private PseudoDiff() {}

    /**
     * Builds the pseudo diff.
     * @param oldText The old version.
     * @param newText The new version.
     * @return The diff text, starting with a fixed file and hunk header.
     */
    public static String between(String oldText, String newText) {
        String[] oldLines = oldText.split("\n", -1);
        String[] newLines = newText.split("\n", -1);
        StringBuilder diff = new StringBuilder(HEADER);
        int max = Math.max(oldLines.length, newLines.length);

        for (int i = 0; i < max; i++) {
            String oldLine = i < oldLines.length ? oldLines[i] : null;
            String newLine = i < newLines.length ? newLines[i] : null;

            if (oldLine == null) {
                diff.append('+').append(newLine).append('\n');
            } else if (newLine == null) {
                diff.append('-').append(oldLine).append('\n');
            } else if (!oldLine.equals(newLine)) {
                diff.append('-').append(oldLine).append('\n');
                diff.append('+').append(newLine).append('\n');
            } else {
                diff.append(' ').append(oldLine).append('\n');
            }
        }
        return diff.toString();
    }
}
