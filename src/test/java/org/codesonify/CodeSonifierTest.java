package org.codesonify;

import org.codesonify.analysis.Language;
import org.codesonify.api.CompositionComparison;
import org.codesonify.api.ISonifier;
import org.codesonify.api.SonificationException;
import org.codesonify.api.SonificationResult;
import org.codesonify.composition.Composition;
import org.codesonify.diff.DiffSonification;
import org.codesonify.music.MusicStyle;
import org.codesonify.music.NoteName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains tests for the {@link CodeSonifier} facade, exercising the full pipeline through the
 * {@link ISonifier} interface.
 */
@Tag("integration")
class CodeSonifierTest {

    private static final String JAVA_SOURCE = String.join("\n",
            "import java.util.List;",
            "",
            "public class Totals {",
            "    public static void main(String[] args) {",
            "        int sum = 0;",
            "        for (int i = 0; i < 10; i++) {",
            "            if (i % 2 == 0) { sum += i; } else { sum -= 1; }",
            "        }",
            "        System.out.println(sum);",
            "    }",
            "}");

    private final ISonifier sonifier = new CodeSonifier();

    @Test
    void sonifiesCodeDeterministically() {
        Composition first = sonifier.sonifyCode(JAVA_SOURCE, null, MusicStyle.ELECTRONIC);
        Composition second = sonifier.sonifyCode(JAVA_SOURCE, null, MusicStyle.ELECTRONIC);

        assertThat(first).isEqualTo(second);
        assertThat(sonifier.encodeToBinary(first)).isEqualTo(sonifier.encodeToBinary(second));
        assertThat(first.metadata().sourceLanguage()).isEqualTo(Language.JAVA);
        assertThat(first.key()).isEqualTo(NoteName.G);
        assertThat(first.tempo()).isBetween(70, 160);
    }

    @Test
    void missingStyleMeansTheDefaultStyle() {
        CodeSonifier jazz = new CodeSonifier(MusicStyle.JAZZ);

        Composition implicit = jazz.sonifyCode(JAVA_SOURCE, null, null);
        Composition explicit = jazz.sonifyCode(JAVA_SOURCE, null, MusicStyle.JAZZ);

        assertThat(jazz.getDefaultStyle()).isEqualTo(MusicStyle.JAZZ);
        assertThat(implicit).isEqualTo(explicit);
        assertThat(new CodeSonifier().sonifyCode(JAVA_SOURCE).metadata().musicalInterpretation())
                .contains("Rendered in classical style");
    }

    @Test
    void rejectsMissingInput() {
        assertThatThrownBy(() -> sonifier.sonifyCode(null, null, MusicStyle.ROCK))
                .isInstanceOf(SonificationException.class)
                .hasMessage("No source code given");
        assertThatThrownBy(() -> sonifier.sonifyDiff(null, null))
                .isInstanceOf(SonificationException.class)
                .hasMessage("No diff text given");
        assertThatThrownBy(() -> sonifier.encodeToBinary(null))
                .isInstanceOf(SonificationException.class);
    }

    @Test
    void base64MatchesTheBinaryEncoding() {
        Composition composition = sonifier.sonifyCode("x = 1");

        byte[] decoded = Base64.getDecoder().decode(sonifier.encodeToBase64(composition));

        assertThat(decoded).isEqualTo(sonifier.encodeToBinary(composition));
        assertThat(new String(decoded, 0, 4, java.nio.charset.StandardCharsets.US_ASCII)).isEqualTo("MThd");
    }

    @Test
    void emptySourceStillProducesAValidFile() {
        Composition composition = sonifier.sonifyCode("");

        assertThat(composition.tracks()).isEmpty();
        assertThat(composition.totalDurationSeconds()).isEqualTo(5.0);
        assertThat(composition.tempo()).isEqualTo(70);
        // header plus the tempo track alone
        assertThat(sonifier.encodeToBinary(composition)).startsWith(0x4D, 0x54, 0x68, 0x64, 0, 0, 0, 6, 0, 1, 0, 1);
    }

    @Test
    void visualizationAccompaniesTheComposition() {
        SonificationResult result = sonifier.sonifyWithVisualization(JAVA_SOURCE, null, MusicStyle.CLASSICAL);

        assertThat(result.composition()).isEqualTo(sonifier.sonifyCode(JAVA_SOURCE, null, MusicStyle.CLASSICAL));
        assertThat(result.analysis().language()).isEqualTo(Language.JAVA);
        assertThat(result.visualization().waveformPoints()).hasSize(200);
        assertThat(result.visualization().tokenColors()).isNotEmpty();
    }

    @Test
    void diffTextAndVersionPairs() {
        DiffSonification diff = sonifier.sonifyDiff("+added\n+more\n-gone\n", MusicStyle.CLASSICAL);

        assertThat(diff.diffStats().addedLines()).isEqualTo(2);
        assertThat(sonifier.sonifyDiffText("+added\n+more\n-gone\n", MusicStyle.CLASSICAL))
                .isEqualTo(diff.composition());
        assertThat(sonifier.sonifyVersionPair("a", "b", null).title())
                .isEqualTo("CodeSonify: Diff Composition (1+ / 1-)");
    }

    @Test
    void comparesTwoSnippets() {
        String simple = "x = 1";

        CompositionComparison comparison = sonifier.compare(JAVA_SOURCE, simple, null);

        assertThat(comparison.a().complexity()).isGreaterThan(comparison.b().complexity());
        assertThat(comparison.verdict()).isEqualTo(CompositionComparison.Verdict.A_FASTER);
        assertThat(sonifier.compare(simple, simple, null).verdict())
                .isEqualTo(CompositionComparison.Verdict.SIMILAR);
        assertThat(sonifier.compare(simple, JAVA_SOURCE, null).verdict())
                .isEqualTo(CompositionComparison.Verdict.B_FASTER);
    }
}
