package org.codesonify.cli.commands;

import org.codesonify.analysis.Language;
import org.codesonify.music.MusicStyle;

/**
 * Resolves the optional style and language names of a command.
 */
final class StyleSelection {

    private StyleSelection() {}

    static MusicStyle style(String name, MusicStyle fallback) {
        return name == null ? fallback : MusicStyle.fromName(name);
    }

    static Language language(String name) {
        return name == null ? null : Language.fromName(name);
    }
}
