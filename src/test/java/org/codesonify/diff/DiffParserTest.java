package org.codesonify.diff;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiffParserTest {

    @Test
    void classifiesLinesByPrefix() {
        String diff = String.join("\n",
                "diff --git a/App.java b/App.java",
                "index 83db48f..bf269f4 100644",
                "--- a/App.java",
                "+++ b/App.java",
                "@@ -1,3 +1,3 @@",
                " class App {",
                "-    int x;",
                "+    long x;",
                "}");

        List<DiffLine> lines = DiffParser.parse(diff);

        assertThat(lines).extracting(DiffLine::type).containsExactly(
                DiffLineType.HEADER, DiffLineType.HEADER, DiffLineType.HEADER, DiffLineType.HEADER,
                DiffLineType.HEADER, DiffLineType.CONTEXT, DiffLineType.REMOVED, DiffLineType.ADDED,
                DiffLineType.CONTEXT);
        assertThat(lines.get(6).content()).isEqualTo("    int x;");
        assertThat(lines.get(7).content()).isEqualTo("    long x;");
        assertThat(lines).extracting(DiffLine::lineNumber).startsWith(1, 2, 3).endsWith(9);
    }

    @Test
    void countsChangesAndTargetFiles() {
        String diff = "--- a\n+++ b\n@@ -1 +1 @@\n+hello\n-world\n";

        DiffStats stats = DiffParser.analyze(DiffParser.parse(diff));

        assertThat(stats.addedLines()).isEqualTo(1);
        assertThat(stats.removedLines()).isEqualTo(1);
        // the empty line after the final newline counts as context
        assertThat(stats.contextLines()).isEqualTo(1);
        assertThat(stats.totalChanges()).isEqualTo(2);
        assertThat(stats.changeRatio()).isEqualTo(0.5);
        assertThat(stats.files()).containsExactly("b");
    }

    @Test
    void stripsTheTargetPrefixAndSkipsTheNullDevice() {
        String diff = String.join("\n",
                "--- a/src/Main.java",
                "+++ b/src/Main.java",
                "+x",
                "--- a/old.txt",
                "+++ /dev/null",
                "-y",
                "--- /dev/null",
                "+++ notes.md ",
                "+z");

        DiffStats stats = DiffParser.analyze(DiffParser.parse(diff));

        assertThat(stats.files()).containsExactly("src/Main.java", "notes.md");
        assertThat(stats.changeRatio()).isEqualTo(2.0 / 3.0);
    }

    @Test
    void diffWithoutChangesIsBalanced() {
        DiffStats stats = DiffParser.analyze(DiffParser.parse(""));

        assertThat(stats.totalChanges()).isZero();
        assertThat(stats.contextLines()).isEqualTo(1);
        assertThat(stats.changeRatio()).isEqualTo(0.5);
        assertThat(stats.files()).isEmpty();
    }
}
