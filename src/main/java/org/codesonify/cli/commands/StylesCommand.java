package org.codesonify.cli.commands;

import org.codesonify.cli.rendering.TextReports;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "styles", description = "Lists the style presets with their key, scale and tempo range.")
public class StylesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getOut().print(TextReports.styles());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
