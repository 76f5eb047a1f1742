package org.codesonify.cli.commands;

import org.codesonify.CodeSonifier;
import org.codesonify.cli.CommandLineInterface;
import org.codesonify.cli.config.SonifyOptions;
import org.codesonify.cli.rendering.JsonRenderer;
import org.codesonify.cli.rendering.TextReports;
import org.codesonify.composition.Composition;
import org.codesonify.diff.DiffSonification;
import org.codesonify.diff.VersionPairSonification;
import org.codesonify.music.MusicStyle;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "diff", description = "Turns a unified diff, or the difference of two files, into a composition.")
public class DiffCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private DiffInput input;

    static class DiffInput {
        @Option(names = "--diff-file", required = true, description = "A file containing a unified diff.")
        private File diffFile;

        @ArgGroup(exclusive = false, multiplicity = "1")
        private Versions versions;
    }

    static class Versions {
        @Option(names = "--old", required = true, description = "The old version of a file.")
        private File oldFile;

        @Option(names = "--new", required = true, description = "The new version of a file.")
        private File newFile;
    }

    @Option(names = {"-s", "--style"}, description = "Style preset: classical, electronic, ambient, jazz or rock.")
    private String style;

    @Option(names = "--json", description = "Print the result as JSON.")
    private boolean json;

    @Option(names = {"-o", "--output"}, description = "Also write the composition as a MIDI file.")
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SonifyOptions options = parent.getOptions();
        CodeSonifier sonifier = new CodeSonifier(options.defaultStyle());
        MusicStyle musicStyle = StyleSelection.style(style, options.defaultStyle());
        JsonRenderer jsonRenderer = new JsonRenderer(options.prettyJson());
        PrintWriter out = spec.commandLine().getOut();

        Composition composition;
        if (input.diffFile != null) {
            String diffText = options.checkSize(SourceInput.readFile(input.diffFile), input.diffFile.getPath());
            DiffSonification result = sonifier.sonifyDiff(diffText, musicStyle);
            out.println(json ? jsonRenderer.render(result) : result.summary());
            composition = result.composition();
        } else {
            String oldText = options.checkSize(SourceInput.readFile(input.versions.oldFile),
                    input.versions.oldFile.getPath());
            String newText = options.checkSize(SourceInput.readFile(input.versions.newFile),
                    input.versions.newFile.getPath());
            VersionPairSonification result = sonifier.sonifyVersions(oldText, newText, musicStyle);
            if (json) {
                out.println(jsonRenderer.render(result));
            } else {
                out.println(result.diff().summary());
                out.println();
                out.print(TextReports.versionComparison(result.oldComposition(), result.newComposition()));
            }
            composition = result.composition();
        }

        if (output != null) {
            Path written = MidiFiles.write(output, options.midiExtension(), sonifier.encodeToBinary(composition));
            spec.commandLine().getErr().println("MIDI file written to " + written);
        }
        out.flush();
        return 0;
    }
}
