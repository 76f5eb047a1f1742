package org.codesonify.midi;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes the event stream of one {@code MTrk} chunk.
 * <p>
 * Events are given at absolute ticks. The writer keeps the tick of the last event and emits each
 * event behind the distance to it, rounded and floored at zero. The cursor follows every event,
 * so an event scheduled earlier than its predecessor moves the cursor back and is written with a
 * zero delta.
 * <p>
 * Not thread-safe; one writer per track.
 */
public class MidiTrackWriter {

    static final byte[] TRACK_TAG = {'M', 'T', 'r', 'k'};

    static final int META = 0xFF;
    static final int META_TEXT = 0x01;
    static final int META_TRACK_NAME = 0x03;
    static final int META_END_OF_TRACK = 0x2F;
    static final int META_TEMPO = 0x51;
    static final int META_TIME_SIGNATURE = 0x58;

    private static final int NOTE_OFF = 0x80;
    private static final int NOTE_ON = 0x90;
    private static final int PROGRAM_CHANGE = 0xC0;

    private final ByteArrayOutputStream events = new ByteArrayOutputStream();
    private long lastTick = 0;

    /**
     * Appends a channel event.
     * @param absoluteTick The tick of the event.
     * @param eventBytes Status and data bytes.
     */
    public void addEvent(long absoluteTick, int... eventBytes) {
        writeDelta(absoluteTick);
        for (int b : eventBytes) {
            events.write(b);
        }
    }

    /**
     * Appends a meta event.
     * @param absoluteTick The tick of the event.
     * @param type The meta type.
     * @param data The payload.
     */
    public void addMeta(long absoluteTick, int type, byte[] data) {
        writeDelta(absoluteTick);
        events.write(META);
        events.write(type);
        events.writeBytes(VariableLengthQuantity.encode(data.length));
        events.writeBytes(data);
    }

    public void addText(String text) {
        addMeta(0, META_TEXT, textBytes(text));
    }

    public void addTrackName(String name) {
        addMeta(0, META_TRACK_NAME, textBytes(name));
    }

    /**
     * Appends the tempo as microseconds per quarter note in three bytes.
     * @param bpm Beats per minute.
     */
    public void addTempo(int bpm) {
        int microsecondsPerBeat = (int) Math.round(60_000_000.0 / bpm);
        addMeta(0, META_TEMPO, new byte[]{
                (byte) (microsecondsPerBeat >> 16),
                (byte) (microsecondsPerBeat >> 8),
                (byte) microsecondsPerBeat});
    }

    /**
     * Appends a time signature with 24 clocks per metronome click and 8 32nd notes per quarter.
     * @param numerator Beats per bar.
     * @param denominator The beat unit; must be a power of two.
     */
    public void addTimeSignature(int numerator, int denominator) {
        int denominatorPower = 31 - Integer.numberOfLeadingZeros(denominator);
        addMeta(0, META_TIME_SIGNATURE, new byte[]{(byte) numerator, (byte) denominatorPower, 24, 8});
    }

    public void addProgramChange(int channel, int program) {
        addEvent(0, PROGRAM_CHANGE | (channel & 0x0F), program & 0x7F);
    }

    /**
     * Appends a note-on. The velocity is scaled to 1..127; zero would read as a note-off.
     * @param tick The tick.
     * @param channel The channel.
     * @param note The MIDI note number.
     * @param velocity The velocity, 0..1.
     */
    public void addNoteOn(long tick, int channel, int note, double velocity) {
        int scaled = (int) Math.min(127, Math.max(1, Math.round(velocity * 127)));
        addEvent(tick, NOTE_ON | (channel & 0x0F), note & 0x7F, scaled);
    }

    public void addNoteOff(long tick, int channel, int note) {
        addEvent(tick, NOTE_OFF | (channel & 0x0F), note & 0x7F, 0);
    }

    /**
     * Closes the stream with an end-of-track event and wraps it in a chunk.
     * The writer must not be used afterwards.
     * @return The complete {@code MTrk} chunk.
     */
    public byte[] build() {
        addMeta(lastTick, META_END_OF_TRACK, new byte[0]);
        byte[] payload = events.toByteArray();

        ByteArrayOutputStream chunk = new ByteArrayOutputStream(payload.length + 8);
        chunk.writeBytes(TRACK_TAG);
        chunk.writeBytes(int32(payload.length));
        chunk.writeBytes(payload);
        return chunk.toByteArray();
    }

    private void writeDelta(long absoluteTick) {
        long delta = Math.max(0, absoluteTick - lastTick);
        events.writeBytes(VariableLengthQuantity.encode((int) Math.min(delta, VariableLengthQuantity.MAX_VALUE)));
        lastTick = absoluteTick;
    }

    static byte[] int32(int value) {
        return new byte[]{(byte) (value >> 24), (byte) (value >> 16), (byte) (value >> 8), (byte) value};
    }

    static byte[] int16(int value) {
        return new byte[]{(byte) (value >> 8), (byte) value};
    }

    // Latin-1 keeps one byte per character; anything beyond it becomes '?'.
    private static byte[] textBytes(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }
}
