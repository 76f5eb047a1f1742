package org.codesonify.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.codesonify.api.SonificationException;
import org.codesonify.music.MusicStyle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SonifyOptionsTest {

    private static Config withOverrides(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    @Test
    void readsTheBundledDefaults() {
        SonifyOptions options = SonifyOptions.from(ConfigFactory.defaultReference());

        assertThat(options.defaultStyle()).isEqualTo(MusicStyle.CLASSICAL);
        assertThat(options.maxInputChars()).isEqualTo(200_000);
        assertThat(options.prettyJson()).isTrue();
        assertThat(options.midiExtension()).isEqualTo(".mid");
    }

    @Test
    void overridesTakePrecedence() {
        SonifyOptions options = SonifyOptions.from(withOverrides("""
            codesonify {
              default-style = "Electronic"
              output.pretty-json = false
            }
            """));

        assertThat(options.defaultStyle()).isEqualTo(MusicStyle.ELECTRONIC);
        assertThat(options.prettyJson()).isFalse();
        assertThat(options.maxInputChars()).isEqualTo(200_000);
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> SonifyOptions.from(withOverrides("codesonify.max-input-chars = 0")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("max-input-chars");
    }

    @Test
    void rejectsUnknownStyles() {
        assertThatThrownBy(() -> SonifyOptions.from(withOverrides("codesonify.default-style = baroque")))
                .isInstanceOf(SonificationException.class)
                .hasMessageContaining("baroque");
    }

    @Test
    void checksInputSize() {
        SonifyOptions options = new SonifyOptions(MusicStyle.ROCK, 5, true, ".mid");

        assertThat(options.checkSize("12345", "input")).isEqualTo("12345");
        assertThatThrownBy(() -> options.checkSize("123456", "notes.txt"))
                .isInstanceOf(SonificationException.class)
                .hasMessage("notes.txt has 6 characters, more than the configured limit of 5");
    }
}
