package org.codesonify.composition;

import org.codesonify.music.Instrument;
import org.codesonify.music.Waveform;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed instrument-to-track tables.
 * <p>
 * {@link #CODE} covers all six instruments. {@link #DIFF} covers the five voices a diff uses; any other
 * instrument gets the diff's ambient settings under its own id as track name.
 */
public enum TrackLayout {
    CODE(codeProfiles()),
    DIFF(diffProfiles());

    private final Map<Instrument, InstrumentProfile> profiles;

    TrackLayout(Map<Instrument, InstrumentProfile> profiles) {
        this.profiles = profiles;
    }

    /**
     * Returns the track settings for an instrument.
     * @param instrument The instrument.
     * @return Its profile, never {@code null}.
     */
    public InstrumentProfile profileFor(Instrument instrument) {
        InstrumentProfile profile = profiles.get(instrument);
        if (profile != null) {
            return profile;
        }
        InstrumentProfile fallback = profiles.get(Instrument.AMBIENT);
        return new InstrumentProfile(instrument.id(), fallback.waveform(), fallback.volume(), fallback.effects());
    }

    private static Map<Instrument, InstrumentProfile> codeProfiles() {
        Map<Instrument, InstrumentProfile> map = new EnumMap<>(Instrument.class);
        map.put(Instrument.MELODY, new InstrumentProfile("Melody (Functions & Logic)", Waveform.TRIANGLE, 0.7,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 2.5, "wet", 0.3))));
        map.put(Instrument.BASS, new InstrumentProfile("Bass (Variables & Data)", Waveform.SINE, 0.5,
                List.of(TrackEffect.of(EffectType.FILTER, "frequency", 400, "type", 0))));
        map.put(Instrument.HARMONY, new InstrumentProfile("Harmony (Conditionals & Branches)", Waveform.SINE, 0.4,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 4, "wet", 0.5),
                        TrackEffect.of(EffectType.CHORUS, "frequency", 1.5, "depth", 0.7))));
        map.put(Instrument.PERCUSSION, new InstrumentProfile("Rhythm (Loops & Iterations)", Waveform.SQUARE, 0.5,
                List.of(TrackEffect.of(EffectType.DISTORTION, "amount", 0.2))));
        map.put(Instrument.AMBIENT, new InstrumentProfile("Ambient (Comments & Structure)", Waveform.SINE, 0.2,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 6, "wet", 0.7),
                        TrackEffect.of(EffectType.DELAY, "time", 0.4, "feedback", 0.3))));
        map.put(Instrument.DISSONANCE, new InstrumentProfile("Dissonance (Errors & Warnings)", Waveform.SAWTOOTH, 0.6,
                List.of(TrackEffect.of(EffectType.DISTORTION, "amount", 0.5),
                        TrackEffect.of(EffectType.FILTER, "frequency", 2000, "type", 1))));
        return map;
    }

    private static Map<Instrument, InstrumentProfile> diffProfiles() {
        Map<Instrument, InstrumentProfile> map = new EnumMap<>(Instrument.class);
        map.put(Instrument.MELODY, new InstrumentProfile("Additions (Ascending Major)", Waveform.TRIANGLE, 0.7,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 2, "wet", 0.3))));
        map.put(Instrument.BASS, new InstrumentProfile("Deletions (Descending Minor)", Waveform.SINE, 0.5,
                List.of(TrackEffect.of(EffectType.FILTER, "frequency", 400, "type", 0))));
        map.put(Instrument.HARMONY, new InstrumentProfile("Significant Changes (Chords)", Waveform.SINE, 0.4,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 3, "wet", 0.5))));
        map.put(Instrument.PERCUSSION, new InstrumentProfile("Change Markers", Waveform.SQUARE, 0.4, List.of()));
        map.put(Instrument.AMBIENT, new InstrumentProfile("Context & Headers", Waveform.SINE, 0.2,
                List.of(TrackEffect.of(EffectType.REVERB, "decay", 5, "wet", 0.6))));
        return map;
    }
}
