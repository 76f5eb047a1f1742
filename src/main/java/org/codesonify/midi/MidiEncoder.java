package org.codesonify.midi;

import org.codesonify.composition.Composition;
import org.codesonify.composition.Track;
import org.codesonify.music.Duration;
import org.codesonify.music.Note;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;

/**
 * Encodes a {@link Composition} as a format 1 Standard MIDI File.
 * <p>
 * The first track carries the title, tempo, time signature and a descriptive text event. Every
 * composition track follows as its own chunk on the channel of its instrument. The output depends
 * on the composition alone, so equal compositions encode to identical bytes.
 */
public class MidiEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(MidiEncoder.class);

    static final byte[] HEADER_TAG = {'M', 'T', 'h', 'd'};
    static final int HEADER_LENGTH = 6;
    static final int FORMAT_MULTI_TRACK = 1;

    /**
     * Encodes a composition.
     * @param composition The composition.
     * @return The file bytes.
     */
    public byte[] encode(Composition composition) {
        List<byte[]> chunks = new ArrayList<>();
        chunks.add(tempoTrack(composition));
        for (Track track : composition.tracks()) {
            chunks.add(noteTrack(track, composition.tempo()));
        }

        ByteArrayOutputStream file = new ByteArrayOutputStream();
        file.writeBytes(HEADER_TAG);
        file.writeBytes(MidiTrackWriter.int32(HEADER_LENGTH));
        file.writeBytes(MidiTrackWriter.int16(FORMAT_MULTI_TRACK));
        file.writeBytes(MidiTrackWriter.int16(chunks.size()));
        file.writeBytes(MidiTrackWriter.int16(Duration.TICKS_PER_QUARTER));
        for (byte[] chunk : chunks) {
            file.writeBytes(chunk);
        }

        byte[] bytes = file.toByteArray();
        LOG.debug("Encoded '{}' as {} track chunks, {} bytes", composition.title(), chunks.size(), bytes.length);
        return bytes;
    }

    /**
     * Encodes a composition and renders the bytes as standard Base64.
     * @param composition The composition.
     * @return The Base64 text.
     */
    public String encodeBase64(Composition composition) {
        return Base64.getEncoder().encodeToString(encode(composition));
    }

    /**
     * Converts a time in seconds to ticks at a tempo.
     * @param seconds The time.
     * @param tempo Beats per minute.
     * @return The tick, rounded to the nearest integer.
     */
    public static long secondsToTicks(double seconds, int tempo) {
        return Math.round(seconds * (tempo / 60.0) * Duration.TICKS_PER_QUARTER);
    }

    private byte[] tempoTrack(Composition composition) {
        MidiTrackWriter writer = new MidiTrackWriter();
        writer.addTrackName(composition.title());
        writer.addTempo(composition.tempo());
        writer.addTimeSignature(composition.timeSignature().numerator(), composition.timeSignature().denominator());
        writer.addText("Generated by CodeSonify | " + composition.metadata().sourceLanguage().id()
                + " | Complexity: " + composition.metadata().complexity() + "/100");
        return writer.build();
    }

    private byte[] noteTrack(Track track, int tempo) {
        MidiTrackWriter writer = new MidiTrackWriter();
        GeneralMidi.Voice voice = GeneralMidi.voiceOf(track.instrument());

        writer.addTrackName(printableAscii(track.name()));
        if (voice.needsProgramChange()) {
            writer.addProgramChange(voice.channel(), voice.program());
        }

        // List.sort is stable, notes starting together keep their order.
        List<Note> sorted = new ArrayList<>(track.notes());
        sorted.sort(Comparator.comparingDouble(Note::startTime));

        int skipped = 0;
        for (Note note : sorted) {
            int pitch = note.pitch().midiNumber();
            if (pitch < 0 || pitch > 127) {
                skipped++;
                continue;
            }
            long start = secondsToTicks(note.startTime(), tempo);
            writer.addNoteOn(start, voice.channel(), pitch, note.velocity());
            writer.addNoteOff(start + note.duration().ticks(), voice.channel(), pitch);
        }
        if (skipped > 0) {
            LOG.debug("Skipped {} notes outside the MIDI range in track '{}'", skipped, track.name());
        }
        return writer.build();
    }

    static String printableAscii(String text) {
        return text.replaceAll("[^\\x20-\\x7E]", "");
    }
}
