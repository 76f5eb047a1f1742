package org.codesonify.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.codesonify.api.SonificationException;
import org.codesonify.music.MusicStyle;

/**
 * Typed view of the {@code codesonify} configuration block.
 *
 * @param defaultStyle The style used when a command names none.
 * @param maxInputChars The largest input, in characters, a command accepts.
 * @param prettyJson Whether JSON output is indented.
 * @param midiExtension The extension appended to MIDI output files that lack one.
 */
public record SonifyOptions(MusicStyle defaultStyle, int maxInputChars, boolean prettyJson, String midiExtension) {

    private static final String ROOT = "codesonify";

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config The configuration; must contain the {@code codesonify} block.
     * @return The options.
     * @throws ConfigException if a key is missing or has the wrong type.
     * @throws SonificationException if the default style is unknown.
     */
    public static SonifyOptions from(Config config) {
        Config block = config.getConfig(ROOT);
        int maxInputChars = block.getInt("max-input-chars");
        if (maxInputChars <= 0) {
            throw new ConfigException.BadValue(block.origin(), ROOT + ".max-input-chars",
                    "must be positive, was " + maxInputChars);
        }
        return new SonifyOptions(
                MusicStyle.fromName(block.getString("default-style")),
                maxInputChars,
                block.getBoolean("output.pretty-json"),
                block.getString("output.midi-extension"));
    }

    /**
     * Rejects input that exceeds the configured limit.
     * @param text The input.
     * @param source A description of where the input came from.
     * @return The input.
     * @throws SonificationException if the input is too large.
     */
    public String checkSize(String text, String source) {
        if (text.length() > maxInputChars) {
            throw new SonificationException(source + " has " + text.length()
                    + " characters, more than the configured limit of " + maxInputChars);
        }
        return text;
    }
}
