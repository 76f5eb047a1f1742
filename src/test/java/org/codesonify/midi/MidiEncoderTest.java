package org.codesonify.midi;

import org.codesonify.analysis.Language;
import org.codesonify.composition.Composition;
import org.codesonify.composition.CompositionMetadata;
import org.codesonify.composition.TimeSignature;
import org.codesonify.composition.Track;
import org.codesonify.diff.DiffSonifier;
import org.codesonify.music.Duration;
import org.codesonify.music.Instrument;
import org.codesonify.music.MusicStyle;
import org.codesonify.music.Note;
import org.codesonify.music.NoteName;
import org.codesonify.music.Pitch;
import org.codesonify.music.ScaleType;
import org.codesonify.music.Waveform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link MidiEncoder}. Most assertions read the produced bytes back
 * with a small chunk and event reader defined at the bottom of this class.
 */
@Tag("unit")
class MidiEncoderTest {

    private final MidiEncoder encoder = new MidiEncoder();

    private static Composition composition(int tempo, Track... tracks) {
        CompositionMetadata metadata = new CompositionMetadata(Language.JAVA, 3, 42, "0000abcd", "test piece");
        return new Composition("Test", tempo, TimeSignature.COMMON, NoteName.C, ScaleType.MAJOR, 1.0,
                List.of(tracks), metadata);
    }

    private static Track track(String name, Instrument instrument, Note... notes) {
        return new Track(name, instrument, Waveform.SINE, 0.5, List.of(notes), List.of());
    }

    private static Note note(NoteName name, int octave, Duration duration, double velocity, double start,
                             Instrument instrument) {
        return new Note(new Pitch(name, octave), duration, velocity, start, instrument);
    }

    @Test
    void writesTheFileHeader() {
        byte[] bytes = encoder.encode(composition(120,
                track("Melody", Instrument.MELODY, note(NoteName.C, 4, Duration.QUARTER, 0.5, 0, Instrument.MELODY))));

        assertThat(Arrays.copyOfRange(bytes, 0, 14)).containsExactly(
                0x4D, 0x54, 0x68, 0x64, 0x00, 0x00, 0x00, 0x06, 0x00, 0x01, 0x00, 0x02, 0x01, 0xE0);
    }

    @Test
    void compositionWithoutTracksStillHasTheTempoTrack() {
        byte[] bytes = encoder.encode(composition(100));

        assertThat(Arrays.copyOfRange(bytes, 10, 12)).containsExactly(0x00, 0x01);
        assertThat(chunks(bytes)).hasSize(1);
        assertThat(new String(Arrays.copyOfRange(bytes, 14, 18), StandardCharsets.US_ASCII)).isEqualTo("MTrk");
    }

    @Test
    void writesASingleNoteTrack() {
        // Arrange
        Composition composition = composition(120,
                track("Melody", Instrument.MELODY, note(NoteName.C, 4, Duration.QUARTER, 0.5, 0, Instrument.MELODY)));

        // Act
        List<byte[]> chunks = chunks(encoder.encode(composition));

        // Assert
        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(1)).containsExactly(
                0x00, 0xFF, 0x03, 0x06, 'M', 'e', 'l', 'o', 'd', 'y',
                0x00, 0xC0, 0x00,
                0x00, 0x90, 0x3C, 0x40,
                0x83, 0x60, 0x80, 0x3C, 0x00,
                0x00, 0xFF, 0x2F, 0x00);
    }

    @Test
    void tempoTrackCarriesTitleTempoMeterAndDescription() {
        List<Event> events = events(chunks(encoder.encode(composition(120)))).get(0);

        assertThat(events).extracting(Event::type).containsExactly(0x03, 0x51, 0x58, 0x01, 0x2F);
        assertThat(events).extracting(Event::delta).containsOnly(0);
        assertThat(text(events.get(0))).isEqualTo("Test");
        assertThat(events.get(1).data()).containsExactly(0x07, 0xA1, 0x20);
        assertThat(events.get(2).data()).containsExactly(0x04, 0x02, 0x18, 0x08);
        assertThat(text(events.get(3))).isEqualTo("Generated by CodeSonify | java | Complexity: 42/100");
    }

    @Test
    void percussionPlaysOnChannelTenWithoutProgramChange() {
        Composition composition = composition(120, track("Rhythm", Instrument.PERCUSSION,
                note(NoteName.C, 2, Duration.SIXTEENTH, 0.3, 0, Instrument.PERCUSSION)));

        List<Event> events = events(chunks(encoder.encode(composition))).get(1);

        assertThat(events).extracting(Event::status).containsExactly(0xFF, 0x99, 0x89, 0xFF);
    }

    @Test
    void sortsNotesAndMovesTheCursorWithEveryEvent() {
        // A whole note at 0 and a quarter note at 0.5s (tick 480) overlap.
        Composition composition = composition(120, track("Bass", Instrument.BASS,
                note(NoteName.E, 2, Duration.QUARTER, 0.4, 0.5, Instrument.BASS),
                note(NoteName.C, 2, Duration.WHOLE, 0.4, 0, Instrument.BASS)));

        List<Event> events = events(chunks(encoder.encode(composition))).get(1);

        // name, program, on C2, off C2 at 1920, on E2 at 480 (delta floored), off E2 at 960, end
        assertThat(events).extracting(Event::status)
                .containsExactly(0xFF, 0xC1, 0x91, 0x81, 0x91, 0x81, 0xFF);
        assertThat(events).extracting(Event::delta).containsExactly(0, 0, 0, 1920, 0, 480, 0);
        assertThat(events.get(4).data()).containsExactly(40, 51);
    }

    @Test
    void skipsPitchesOutsideTheMidiRange() {
        Composition composition = composition(120, track("Melody", Instrument.MELODY,
                note(NoteName.C, 10, Duration.QUARTER, 0.5, 0, Instrument.MELODY),
                note(NoteName.G, 9, Duration.QUARTER, 0.5, 0, Instrument.MELODY),
                note(NoteName.C, -2, Duration.QUARTER, 0.5, 0, Instrument.MELODY)));

        List<Event> events = events(chunks(encoder.encode(composition))).get(1);

        // G9 is 127 and stays
        assertThat(events).filteredOn(event -> event.status() == 0x90)
                .singleElement().satisfies(event -> assertThat(event.data()[0]).isEqualTo(127));
    }

    @Test
    void quietNotesKeepAudibleVelocity() {
        Composition composition = composition(120, track("Ambient", Instrument.AMBIENT,
                note(NoteName.A, 3, Duration.HALF, 0.0, 0, Instrument.AMBIENT),
                note(NoteName.A, 3, Duration.HALF, 1.0, 1, Instrument.AMBIENT)));

        List<Event> events = events(chunks(encoder.encode(composition))).get(1);

        assertThat(events).filteredOn(event -> event.status() == 0x93)
                .extracting(event -> event.data()[1]).containsExactly(1, 127);
    }

    @Test
    void stripsNonAsciiFromTrackNames() {
        assertThat(MidiEncoder.printableAscii("Melodie ♫é\n")).isEqualTo("Melodie ");
    }

    @Test
    void convertsSecondsToTicks() {
        assertThat(MidiEncoder.secondsToTicks(0.5, 120)).isEqualTo(480);
        assertThat(MidiEncoder.secondsToTicks(1.0, 90)).isEqualTo(720);
        assertThat(MidiEncoder.secondsToTicks(0.001, 120)).isEqualTo(1);
    }

    @Test
    void encodingIsDeterministicAndWellFormed() {
        Composition composition = new DiffSonifier()
                .sonifyDiff("--- a\n+++ b\n@@ -1,2 +1,2 @@\n-old line of code here\n+a longer replacement line of code\n",
                        MusicStyle.CLASSICAL)
                .composition();

        byte[] first = encoder.encode(composition);
        byte[] second = encoder.encode(composition);

        assertThat(first).isEqualTo(second);
        assertThat(Base64.getDecoder().decode(encoder.encodeBase64(composition))).isEqualTo(first);
        List<List<Event>> tracks = events(chunks(first));
        assertThat(tracks).hasSize(composition.tracks().size() + 1);
        assertThat(tracks).allSatisfy(events -> {
            assertThat(events).last().satisfies(event -> assertThat(event.type()).isEqualTo(0x2F));
            assertThat(events).filteredOn(event -> (event.status() & 0xF0) == 0x90)
                    .allSatisfy(event -> assertThat(event.data()[1]).isBetween(1, 127));
        });
    }

    // Reading helpers

    private record Event(int delta, int status, int type, int[] data) {}

    private static List<byte[]> chunks(byte[] file) {
        List<byte[]> payloads = new ArrayList<>();
        int position = 14;
        while (position < file.length) {
            assertThat(new String(file, position, 4, StandardCharsets.US_ASCII)).isEqualTo("MTrk");
            int length = ((file[position + 4] & 0xFF) << 24) | ((file[position + 5] & 0xFF) << 16)
                    | ((file[position + 6] & 0xFF) << 8) | (file[position + 7] & 0xFF);
            payloads.add(Arrays.copyOfRange(file, position + 8, position + 8 + length));
            position += 8 + length;
        }
        return payloads;
    }

    private static List<List<Event>> events(List<byte[]> chunks) {
        List<List<Event>> tracks = new ArrayList<>();
        for (byte[] chunk : chunks) {
            List<Event> events = new ArrayList<>();
            int position = 0;
            while (position < chunk.length) {
                VariableLengthQuantity.Decoded delta = VariableLengthQuantity.decode(chunk, position);
                position += delta.byteCount();
                int status = chunk[position++] & 0xFF;
                if (status == 0xFF) {
                    int type = chunk[position++] & 0xFF;
                    VariableLengthQuantity.Decoded length = VariableLengthQuantity.decode(chunk, position);
                    position += length.byteCount();
                    events.add(new Event(delta.value(), status, type, slice(chunk, position, length.value())));
                    position += length.value();
                } else {
                    int dataLength = (status & 0xF0) == 0xC0 ? 1 : 2;
                    events.add(new Event(delta.value(), status, -1, slice(chunk, position, dataLength)));
                    position += dataLength;
                }
            }
            tracks.add(events);
        }
        return tracks;
    }

    private static int[] slice(byte[] bytes, int from, int length) {
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = bytes[from + i] & 0xFF;
        }
        return values;
    }

    private static String text(Event event) {
        StringBuilder text = new StringBuilder();
        for (int b : event.data()) {
            text.append((char) b);
        }
        return text.toString();
    }
}
