package org.codesonify;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.CodeAnalyzer;
import org.codesonify.analysis.Language;
import org.codesonify.api.CompositionComparison;
import org.codesonify.api.ISonifier;
import org.codesonify.api.SonificationException;
import org.codesonify.api.SonificationResult;
import org.codesonify.composition.Composer;
import org.codesonify.composition.Composition;
import org.codesonify.composition.CompositionAssembler;
import org.codesonify.diff.DiffMapper;
import org.codesonify.diff.DiffSonification;
import org.codesonify.diff.DiffSonifier;
import org.codesonify.diff.VersionPairSonification;
import org.codesonify.midi.MidiEncoder;
import org.codesonify.music.MusicMapper;
import org.codesonify.music.MusicStyle;
import org.codesonify.visualization.VisualizationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link ISonifier}. It validates arguments at the boundary and delegates to the
 * analysis, mapping, assembly and encoding stages.
 * <p>
 * All collaborators are stateless, so one instance may serve concurrent callers.
 */
public class CodeSonifier implements ISonifier {

    private static final Logger LOG = LoggerFactory.getLogger(CodeSonifier.class);

    private final MusicStyle defaultStyle;
    private final CodeAnalyzer analyzer;
    private final Composer composer;
    private final DiffSonifier diffSonifier;
    private final MidiEncoder encoder;
    private final VisualizationBuilder visualizationBuilder;

    public CodeSonifier() {
        this(MusicStyle.DEFAULT);
    }

    /**
     * Creates a sonifier.
     * @param defaultStyle The style used when a call passes {@code null}.
     */
    public CodeSonifier(MusicStyle defaultStyle) {
        this.defaultStyle = requireNonNull(defaultStyle, "default style");
        this.analyzer = new CodeAnalyzer();
        CompositionAssembler assembler = new CompositionAssembler();
        this.composer = new Composer(analyzer, new MusicMapper(), assembler);
        this.diffSonifier = new DiffSonifier(composer, new DiffMapper(), assembler);
        this.encoder = new MidiEncoder();
        this.visualizationBuilder = new VisualizationBuilder();
    }

    public MusicStyle getDefaultStyle() {
        return defaultStyle;
    }

    @Override
    public CodeAnalysis analyzeCode(String source, Language languageHint) {
        return analyzer.analyze(requireNonNull(source, "source code"), languageHint);
    }

    @Override
    public Composition sonifyCode(String source, Language languageHint, MusicStyle style) {
        requireNonNull(source, "source code");
        return composer.compose(source, languageHint, styleOrDefault(style)).composition();
    }

    @Override
    public SonificationResult sonifyWithVisualization(String source, Language languageHint, MusicStyle style) {
        requireNonNull(source, "source code");
        Composer.Result result = composer.compose(source, languageHint, styleOrDefault(style));
        return new SonificationResult(result.composition(), result.analysis(),
                visualizationBuilder.build(result.analysis(), result.notes()));
    }

    @Override
    public DiffSonification sonifyDiff(String diffText, MusicStyle style) {
        return diffSonifier.sonifyDiff(requireNonNull(diffText, "diff text"), styleOrDefault(style));
    }

    @Override
    public VersionPairSonification sonifyVersions(String oldText, String newText, MusicStyle style) {
        requireNonNull(oldText, "old version");
        requireNonNull(newText, "new version");
        return diffSonifier.sonifyTwoVersions(oldText, newText, styleOrDefault(style));
    }

    @Override
    public CompositionComparison compare(String sourceA, String sourceB, MusicStyle style) {
        requireNonNull(sourceA, "first source code");
        requireNonNull(sourceB, "second source code");
        MusicStyle resolved = styleOrDefault(style);
        Composer.Result a = composer.compose(sourceA, null, resolved);
        Composer.Result b = composer.compose(sourceB, null, resolved);
        CompositionComparison comparison = CompositionComparison.of(a.analysis(), a.composition(),
                b.analysis(), b.composition());
        LOG.debug("Compared {} BPM against {} BPM: {}", a.composition().tempo(), b.composition().tempo(),
                comparison.verdict());
        return comparison;
    }

    @Override
    public byte[] encodeToBinary(Composition composition) {
        return encoder.encode(requireNonNull(composition, "composition"));
    }

    @Override
    public String encodeToBase64(Composition composition) {
        return encoder.encodeBase64(requireNonNull(composition, "composition"));
    }

    private MusicStyle styleOrDefault(MusicStyle style) {
        return style != null ? style : defaultStyle;
    }

    private static <T> T requireNonNull(T value, String what) {
        if (value == null) {
            throw new SonificationException("No " + what + " given");
        }
        return value;
    }
}
