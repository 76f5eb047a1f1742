package org.codesonify.cli.commands;

import org.codesonify.CodeSonifier;
import org.codesonify.api.CompositionComparison;
import org.codesonify.cli.CommandLineInterface;
import org.codesonify.cli.config.SonifyOptions;
import org.codesonify.cli.rendering.TextReports;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "compare", description = "Compares two source files by their compositions.")
public class CompareCommand implements Callable<Integer> {

    @Option(names = {"-a", "--first"}, required = true, description = "The first source file.")
    private File first;

    @Option(names = {"-b", "--second"}, required = true, description = "The second source file.")
    private File second;

    @Option(names = {"-s", "--style"}, description = "Style preset: classical, electronic, ambient, jazz or rock.")
    private String style;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SonifyOptions options = parent.getOptions();
        String sourceA = options.checkSize(SourceInput.readFile(first), first.getPath());
        String sourceB = options.checkSize(SourceInput.readFile(second), second.getPath());

        CompositionComparison comparison = new CodeSonifier(options.defaultStyle())
                .compare(sourceA, sourceB, StyleSelection.style(style, options.defaultStyle()));

        spec.commandLine().getOut().print(TextReports.comparison(comparison));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
