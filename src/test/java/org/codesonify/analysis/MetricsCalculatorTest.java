package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MetricsCalculatorTest {

    private static CodeMetrics metricsOf(String source) {
        Lexer lexer = new Lexer(source);
        return MetricsCalculator.calculate(lexer.getLines(), lexer.scanTokens());
    }

    @Test
    void complexityIsCappedAtOneHundred() {
        String source = String.join("\n", Collections.nCopies(40, "if (f(x)) { while (g(y)) {"));

        CodeMetrics metrics = metricsOf(source);

        assertThat(metrics.maxNestingDepth()).isGreaterThanOrEqualTo(3);
        assertThat(metrics.complexity()).isEqualTo(100);
    }

    @Test
    void complexityStaysWithinBoundsForOddInput() {
        for (String source : new String[]{"", "}}}}", "\n\n\n", "((((((((((", "\"unterminated", "a\tb\r\nc"}) {
            assertThat(metricsOf(source).complexity()).isBetween(0, 100);
        }
    }

    @Test
    void sumsTheCappedParts() {
        // depth 1 -> 10, one conditional -> 5, three code lines -> 1.5, rounded half up
        CodeMetrics metrics = metricsOf("if x {\n  y\n}");

        assertThat(metrics.codeLines()).isEqualTo(3);
        assertThat(metrics.complexity()).isEqualTo(17);
    }
}
