package org.codesonify.cli.commands;

import org.codesonify.CodeSonifier;
import org.codesonify.analysis.CodeAnalysis;
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
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Analyzes source code and reports its metrics and structure.")
public class AnalyzeCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private SourceInput input;

    @Option(names = {"-l", "--language"}, description = "Language to report instead of detecting it.")
    private String language;

    @Option(names = "--json", description = "Print the full analysis as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SonifyOptions options = parent.getOptions();
        String source = input.read(options);

        CodeAnalysis analysis = new CodeSonifier(options.defaultStyle())
                .analyzeCode(source, StyleSelection.language(language));

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(new JsonRenderer(options.prettyJson()).render(analysis));
        } else {
            out.print(TextReports.analysis(analysis));
        }
        out.flush();
        return 0;
    }
}
