package org.codesonify.composition;

import org.codesonify.music.Waveform;

import java.util.List;

/**
 * The sound settings given to the track of one instrument.
 *
 * @param trackName Display name of the track.
 * @param waveform Suggested oscillator shape.
 * @param volume Track volume in [0, 1].
 * @param effects The effect chain.
 */
public record InstrumentProfile(String trackName, Waveform waveform, double volume, List<TrackEffect> effects) {

    public InstrumentProfile {
        effects = List.copyOf(effects);
    }
}
