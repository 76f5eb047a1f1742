package org.codesonify.midi;

import org.codesonify.music.Instrument;

import java.util.EnumMap;
import java.util.Map;

/**
 * Channel and General MIDI program assignment per instrument.
 */
public final class GeneralMidi {

    /** Channel 10 in one-based numbering; it plays drum sounds and takes no program change. */
    public static final int PERCUSSION_CHANNEL = 9;

    /**
     * Where an instrument plays.
     *
     * @param channel The zero-based MIDI channel.
     * @param program The General MIDI program number.
     */
    public record Voice(int channel, int program) {

        /** @return Whether this voice needs a program change at the start of its track. */
        public boolean needsProgramChange() {
            return channel != PERCUSSION_CHANNEL;
        }
    }

    private static final Map<Instrument, Voice> VOICES = new EnumMap<>(Instrument.class);

    static {
        VOICES.put(Instrument.MELODY, new Voice(0, 0));        // Acoustic Grand Piano
        VOICES.put(Instrument.BASS, new Voice(1, 33));         // Electric Bass (finger)
        VOICES.put(Instrument.HARMONY, new Voice(2, 48));      // String Ensemble 1
        VOICES.put(Instrument.AMBIENT, new Voice(3, 88));      // Pad 1 (new age)
        VOICES.put(Instrument.DISSONANCE, new Voice(4, 30));   // Overdriven Guitar
        VOICES.put(Instrument.PERCUSSION, new Voice(PERCUSSION_CHANNEL, 115));
    }

    private GeneralMidi() {}

    /**
     * Looks up the voice of an instrument.
     * @param instrument The instrument.
     * @return The voice; channel 0, program 0 for an unmapped instrument.
     */
    public static Voice voiceOf(Instrument instrument) {
        return VOICES.getOrDefault(instrument, new Voice(0, 0));
    }
}
