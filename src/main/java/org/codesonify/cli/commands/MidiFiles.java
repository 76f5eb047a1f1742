package org.codesonify.cli.commands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes encoded MIDI data to disk.
 */
final class MidiFiles {

    private MidiFiles() {}

    /**
     * Writes the bytes, appending the extension when the file name has none.
     *
     * @param target The requested path.
     * @param extension The default extension, including its dot.
     * @param bytes The file content.
     * @return The path written to.
     * @throws IOException if the file cannot be written.
     */
    static Path write(Path target, String extension, byte[] bytes) throws IOException {
        Path path = target;
        String name = target.getFileName().toString();
        if (!name.contains(".")) {
            path = target.resolveSibling(name + extension);
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.write(path, bytes);
    }
}
