package org.codesonify.cli.commands;

import org.codesonify.CodeSonifier;
import org.codesonify.cli.CommandLineInterface;
import org.codesonify.cli.config.SonifyOptions;
import org.codesonify.composition.Composition;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "export-midi", description = "Turns source code into a Standard MIDI File.")
public class ExportMidiCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private SourceInput input;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    static class Target {
        @Option(names = {"-o", "--output"}, required = true, description = "The MIDI file to write.")
        private Path output;

        @Option(names = "--base64", required = true, description = "Print the file as Base64 instead.")
        private boolean base64;
    }

    @Option(names = {"-l", "--language"}, description = "Language to report instead of detecting it.")
    private String language;

    @Option(names = {"-s", "--style"}, description = "Style preset: classical, electronic, ambient, jazz or rock.")
    private String style;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SonifyOptions options = parent.getOptions();
        String source = input.read(options);
        CodeSonifier sonifier = new CodeSonifier(options.defaultStyle());

        Composition composition = sonifier.sonifyCode(source, StyleSelection.language(language),
                StyleSelection.style(style, options.defaultStyle()));

        PrintWriter out = spec.commandLine().getOut();
        if (target.base64) {
            out.println(sonifier.encodeToBase64(composition));
        } else {
            byte[] bytes = sonifier.encodeToBinary(composition);
            Path written = MidiFiles.write(target.output, options.midiExtension(), bytes);
            out.println("Wrote " + bytes.length + " bytes (" + (composition.tracks().size() + 1) + " tracks, "
                    + composition.noteCount() + " notes, " + composition.tempo() + " BPM) to " + written);
        }
        out.flush();
        return 0;
    }
}
