package org.codesonify.music;

import org.codesonify.api.SonificationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PitchTest {

    @Test
    void middleCAndConcertA() {
        assertThat(new Pitch(NoteName.C, 4).midiNumber()).isEqualTo(60);
        assertThat(new Pitch(NoteName.A, 4).midiNumber()).isEqualTo(69);
        assertThat(new Pitch(NoteName.A, 4).frequency()).isCloseTo(440.0, within(1e-9));
        assertThat(new Pitch(NoteName.A, 5).frequency()).isCloseTo(880.0, within(1e-9));
    }

    @Test
    void intervalsAboveTheKeyCarryIntoTheNextOctave() {
        assertThat(Pitch.above(NoteName.A, 3, 4)).isEqualTo(new Pitch(NoteName.C, 5));
        assertThat(Pitch.above(NoteName.C, 12, 4)).isEqualTo(new Pitch(NoteName.C, 5));
        assertThat(Pitch.above(NoteName.E, 7, 4).toString()).isEqualTo("B4");
    }

    @Test
    void noteNamesWrapAround() {
        assertThat(NoteName.fromSemitone(13)).isEqualTo(NoteName.C_SHARP);
        assertThat(NoteName.fromSemitone(-1)).isEqualTo(NoteName.B);
    }

    @Test
    void dottedDurationsAreHalfAgainAsLong() {
        assertThat(Duration.DOTTED_HALF.ticks()).isEqualTo(Duration.HALF.ticks() * 3 / 2);
        assertThat(Duration.DOTTED_QUARTER.referenceSeconds()).isEqualTo(0.75);
        assertThat(Duration.DOTTED_QUARTER).hasToString("4n.");
    }

    @Test
    void stylesResolveByName() {
        assertThat(MusicStyle.fromName("JAZZ")).isEqualTo(MusicStyle.JAZZ);
        assertThatThrownBy(() -> MusicStyle.fromName("polka"))
                .isInstanceOf(SonificationException.class)
                .hasMessageContaining("classical");
    }

    @Test
    void velocityIsClamped() {
        Note loud = new Note(new Pitch(NoteName.C, 4), Duration.QUARTER, 1.7, 0, Instrument.MELODY);
        Note silent = new Note(new Pitch(NoteName.C, 4), Duration.QUARTER, -0.2, 0, Instrument.MELODY);

        assertThat(loud.velocity()).isEqualTo(1.0);
        assertThat(silent.velocity()).isEqualTo(0.0);
    }

    @Test
    void octaveForDepthIsClamped() {
        assertThat(MappingConfig.DEFAULT.octaveForDepth(0)).isEqualTo(4);
        assertThat(MappingConfig.DEFAULT.octaveForDepth(1)).isEqualTo(5);
        assertThat(MappingConfig.DEFAULT.octaveForDepth(9)).isEqualTo(6);
    }
}
