package org.codesonify.diff;

import java.util.List;

/**
 * Summary statistics of a parsed diff.
 *
 * @param addedLines Number of added lines.
 * @param removedLines Number of removed lines.
 * @param contextLines Number of context lines.
 * @param totalChanges Added plus removed lines.
 * @param changeRatio {@code added / (added + removed)}, or 0.5 when nothing changed.
 * @param files File names taken from {@code +++} headers, without the null device.
 */
public record DiffStats(
        int addedLines,
        int removedLines,
        int contextLines,
        int totalChanges,
        double changeRatio,
        List<String> files
) {
    public DiffStats {
        files = List.copyOf(files);
    }
}
