package org.codesonify.cli.commands;

import org.codesonify.CodeSonifier;
import org.codesonify.api.SonificationResult;
import org.codesonify.cli.CommandLineInterface;
import org.codesonify.cli.config.SonifyOptions;
import org.codesonify.cli.rendering.JsonRenderer;
import org.codesonify.cli.rendering.TextReports;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "sonify", description = "Turns source code into a composition.")
public class SonifyCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private SourceInput input;

    @Option(names = {"-l", "--language"}, description = "Language to report instead of detecting it.")
    private String language;

    @Option(names = {"-s", "--style"}, description = "Style preset: classical, electronic, ambient, jazz or rock.")
    private String style;

    @Option(names = "--json", description = "Print the composition, analysis and visualization data as JSON.")
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
        String source = input.read(options);
        CodeSonifier sonifier = new CodeSonifier(options.defaultStyle());

        SonificationResult result = sonifier.sonifyWithVisualization(source,
                StyleSelection.language(language), StyleSelection.style(style, options.defaultStyle()));

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(new JsonRenderer(options.prettyJson()).render(result));
        } else {
            out.print(TextReports.composition(result.composition()));
        }
        if (output != null) {
            Path written = MidiFiles.write(output, options.midiExtension(),
                    sonifier.encodeToBinary(result.composition()));
            spec.commandLine().getErr().println("MIDI file written to " + written);
        }
        out.flush();
        return 0;
    }
}
