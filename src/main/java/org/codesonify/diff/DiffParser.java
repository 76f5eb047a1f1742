package org.codesonify.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the lines of a unified diff by prefix. Hunk headers are recognized but not interpreted.
 */
public final class DiffParser {

    private static final String NULL_DEVICE = "/dev/null";
    private static final String[] HEADER_PREFIXES = {"+++", "---", "diff ", "index ", "@@"};

    private DiffParser() {}

    /**
     * Splits diff text into classified lines.
     * @param diffText The diff text.
     * @return One entry per line, in order.
     */
    public static List<DiffLine> parse(String diffText) {
        String[] lines = diffText.split("\n", -1);
        List<DiffLine> parsed = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            parsed.add(classify(lines[i], i + 1));
        }
        return parsed;
    }

    private static DiffLine classify(String line, int lineNumber) {
        for (String prefix : HEADER_PREFIXES) {
            if (line.startsWith(prefix)) {
                return new DiffLine(DiffLineType.HEADER, line, lineNumber);
            }
        }
        if (line.startsWith("+")) {
            return new DiffLine(DiffLineType.ADDED, line.substring(1), lineNumber);
        }
        if (line.startsWith("-")) {
            return new DiffLine(DiffLineType.REMOVED, line.substring(1), lineNumber);
        }
        return new DiffLine(DiffLineType.CONTEXT, line, lineNumber);
    }

    /**
     * Computes summary statistics over parsed lines.
     * @param lines The parsed lines.
     * @return The statistics.
     */
    public static DiffStats analyze(List<DiffLine> lines) {
        int added = 0;
        int removed = 0;
        int context = 0;
        List<String> files = new ArrayList<>();
        for (DiffLine line : lines) {
            switch (line.type()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case CONTEXT -> context++;
                case HEADER -> {
                    String file = targetFile(line.content());
                    if (file != null) {
                        files.add(file);
                    }
                }
            }
        }
        int total = added + removed;
        double ratio = total > 0 ? (double) added / total : 0.5;
        return new DiffStats(added, removed, context, total, ratio, files);
    }

    private static String targetFile(String header) {
        String name;
        if (header.startsWith("+++ b/")) {
            name = header.substring("+++ b/".length());
        } else if (header.startsWith("+++ ")) {
            name = header.substring("+++ ".length());
        } else {
            return null;
        }
        name = name.trim();
        return name.isEmpty() || name.equals(NULL_DEVICE) ? null : name;
    }
}
