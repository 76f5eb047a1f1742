package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Token;
import org.codesonify.analysis.lexer.TokenKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CodeAnalyzerTest {

    private final CodeAnalyzer analyzer = new CodeAnalyzer();

    @Test
    void analyzesOneLineFunction() {
        CodeAnalysis analysis = analyzer.analyze("function add(a, b) { return a + b; }");

        assertThat(analysis.language()).isEqualTo(Language.UNKNOWN);
        assertThat(analysis.tokens()).extracting(Token::kind)
                .contains(TokenKind.FUNCTION, TokenKind.BRACKET_OPEN, TokenKind.RETURN_STMT, TokenKind.BRACKET_CLOSE);
        assertThat(analysis.metrics().functionCount()).isEqualTo(1);
        assertThat(analysis.metrics().totalLines()).isEqualTo(1);
        assertThat(analysis.metrics().codeLines()).isEqualTo(1);
        // size 0.5 + functions 3
        assertThat(analysis.metrics().complexity()).isEqualTo(4);
        assertThat(analysis.structures()).singleElement()
                .satisfies(structure -> {
                    assertThat(structure.kind()).isEqualTo(TokenKind.FUNCTION);
                    assertThat(structure.name()).isEqualTo("add");
                    assertThat(structure.startLine()).isEqualTo(1);
                    assertThat(structure.endLine()).isEqualTo(1);
                });
    }

    @Test
    void emptyInputYieldsEmptyAnalysis() {
        CodeAnalysis analysis = analyzer.analyze("");

        assertThat(analysis.language()).isEqualTo(Language.UNKNOWN);
        assertThat(analysis.tokens()).isEmpty();
        assertThat(analysis.structures()).isEmpty();
        assertThat(analysis.metrics()).isEqualTo(CodeMetrics.EMPTY);
    }

    @Test
    void languageHintOverridesDetection() {
        CodeAnalysis analysis = analyzer.analyze("def foo(x):\n    print(x)", Language.RUST);

        assertThat(analysis.language()).isEqualTo(Language.RUST);
    }

    @Test
    void countsCommentsAndBlankLines() {
        String source = String.join("\n",
                "// header",
                "",
                "let x = 1",
                "while (x) {",
                "}");

        CodeMetrics metrics = analyzer.analyze(source).metrics();

        assertThat(metrics.totalLines()).isEqualTo(5);
        assertThat(metrics.commentLines()).isEqualTo(1);
        assertThat(metrics.emptyLines()).isEqualTo(1);
        assertThat(metrics.codeLines()).isEqualTo(3);
        assertThat(metrics.variableCount()).isEqualTo(1);
        assertThat(metrics.loopCount()).isEqualTo(1);
        assertThat(metrics.maxNestingDepth()).isEqualTo(1);
    }
}
