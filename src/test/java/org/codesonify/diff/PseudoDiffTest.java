package org.codesonify.diff;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PseudoDiffTest {

    @Test
    void pairsLinesByIndex() {
        String diff = PseudoDiff.between("a\nb", "a\nc\nd");

        assertThat(diff).isEqualTo(PseudoDiff.HEADER + " a\n-b\n+c\n+d\n");
    }

    @Test
    void shorterNewVersionBecomesRemovals() {
        String diff = PseudoDiff.between("x\ny\nz", "x");

        assertThat(diff).isEqualTo(PseudoDiff.HEADER + " x\n-y\n-z\n");
    }

    @Test
    void identicalVersionsAreAllContext() {
        DiffStats stats = DiffParser.analyze(DiffParser.parse(PseudoDiff.between("same\ntext", "same\ntext")));

        assertThat(stats.totalChanges()).isZero();
        assertThat(stats.files()).containsExactly("new.code");
    }
}
