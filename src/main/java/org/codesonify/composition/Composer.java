package org.codesonify.composition;

import org.codesonify.analysis.CodeAnalysis;
import org.codesonify.analysis.CodeAnalyzer;
import org.codesonify.analysis.Language;
import org.codesonify.music.MusicMapper;
import org.codesonify.music.MusicStyle;
import org.codesonify.music.Note;

import java.util.List;

/**
 * Runs the code pipeline end to end: analysis, note mapping and assembly.
 * <p>
 * Holds only stateless collaborators and may be shared between threads.
 */
public class Composer {

    private final CodeAnalyzer analyzer;
    private final MusicMapper mapper;
    private final CompositionAssembler assembler;

    public Composer() {
        this(new CodeAnalyzer(), new MusicMapper(), new CompositionAssembler());
    }

    public Composer(CodeAnalyzer analyzer, MusicMapper mapper, CompositionAssembler assembler) {
        this.analyzer = analyzer;
        this.mapper = mapper;
        this.assembler = assembler;
    }

    /**
     * Everything one pipeline run produced.
     *
     * @param analysis The code analysis.
     * @param notes The notes in generation order.
     * @param composition The assembled composition.
     */
    public record Result(CodeAnalysis analysis, List<Note> notes, Composition composition) {}

    /**
     * Composes a piece from source text.
     *
     * @param source The source text.
     * @param languageHint The language to report, or {@code null} to detect it.
     * @param style The style preset.
     * @return The pipeline result.
     */
    public Result compose(String source, Language languageHint, MusicStyle style) {
        CodeAnalysis analysis = analyzer.analyze(source, languageHint);
        List<Note> notes = mapper.mapToNotes(analysis, style);
        int tempo = mapper.tempoFromComplexity(analysis.metrics().complexity());
        Composition composition = assembler.assembleCode(source, analysis, notes, style, tempo);
        return new Result(analysis, notes, composition);
    }
}
