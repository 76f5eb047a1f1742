package org.codesonify.cli.commands;

import org.codesonify.cli.config.SonifyOptions;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Source text given either as a file or inline. Used as an exclusive argument group.
 */
public class SourceInput {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--code", required = true, description = "The source code as inline text.")
    private String code;

    /**
     * Reads the source text and checks it against the configured size limit.
     * @param options The command line options.
     * @return The source text.
     * @throws IOException if the file cannot be read.
     */
    public String read(SonifyOptions options) throws IOException {
        if (file != null) {
            return options.checkSize(readFile(file), file.getPath());
        }
        return options.checkSize(code, "Inline code");
    }

    static String readFile(File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }
}
