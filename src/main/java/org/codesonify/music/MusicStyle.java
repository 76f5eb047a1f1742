package org.codesonify.music;

import com.google.gson.annotations.SerializedName;
import org.codesonify.api.SonificationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Style presets. A preset fixes the key and scale the mapper writes in; the tempo range,
 * waveforms, duration bias and reverb amount describe the character of the style.
 */
public enum MusicStyle {
    @SerializedName("classical")
    CLASSICAL("classical", NoteName.C, ScaleType.MAJOR, 80, 130,
            List.of(Waveform.SINE, Waveform.TRIANGLE),
            List.of(Duration.QUARTER, Duration.HALF, Duration.EIGHTH), 0.5),
    @SerializedName("electronic")
    ELECTRONIC("electronic", NoteName.A, ScaleType.MINOR, 110, 150,
            List.of(Waveform.SQUARE, Waveform.SAWTOOTH),
            List.of(Duration.EIGHTH, Duration.SIXTEENTH, Duration.QUARTER), 0.3),
    @SerializedName("ambient")
    AMBIENT("ambient", NoteName.D, ScaleType.PENTATONIC, 60, 90,
            List.of(Waveform.SINE, Waveform.TRIANGLE),
            List.of(Duration.HALF, Duration.WHOLE, Duration.DOTTED_QUARTER), 0.8),
    @SerializedName("jazz")
    JAZZ("jazz", NoteName.F, ScaleType.DORIAN, 90, 140,
            List.of(Waveform.SINE, Waveform.TRIANGLE),
            List.of(Duration.DOTTED_EIGHTH, Duration.QUARTER, Duration.EIGHTH), 0.4),
    @SerializedName("rock")
    ROCK("rock", NoteName.E, ScaleType.BLUES, 100, 150,
            List.of(Waveform.SAWTOOTH, Waveform.SQUARE),
            List.of(Duration.EIGHTH, Duration.QUARTER, Duration.SIXTEENTH), 0.2);

    /** The style used when a caller does not name one. */
    public static final MusicStyle DEFAULT = CLASSICAL;

    private final String id;
    private final NoteName baseKey;
    private final ScaleType scale;
    private final int minBpm;
    private final int maxBpm;
    private final List<Waveform> preferredWaveforms;
    private final List<Duration> durationBias;
    private final double reverbAmount;

    MusicStyle(String id, NoteName baseKey, ScaleType scale, int minBpm, int maxBpm,
               List<Waveform> preferredWaveforms, List<Duration> durationBias, double reverbAmount) {
        this.id = id;
        this.baseKey = baseKey;
        this.scale = scale;
        this.minBpm = minBpm;
        this.maxBpm = maxBpm;
        this.preferredWaveforms = preferredWaveforms;
        this.durationBias = durationBias;
        this.reverbAmount = reverbAmount;
    }

    /**
     * Resolves a style by its id, ignoring case.
     *
     * @param name The style id, e.g. {@code "jazz"}.
     * @return The style.
     * @throws SonificationException if no style has that id.
     */
    public static MusicStyle fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (MusicStyle style : values()) {
                if (style.id.equals(normalized)) {
                    return style;
                }
            }
        }
        throw new SonificationException("Unknown style '" + name + "'. Expected one of: "
                + Arrays.stream(values()).map(MusicStyle::id).collect(Collectors.joining(", ")));
    }

    public String id() {
        return id;
    }

    public NoteName baseKey() {
        return baseKey;
    }

    public ScaleType scale() {
        return scale;
    }

    public int minBpm() {
        return minBpm;
    }

    public int maxBpm() {
        return maxBpm;
    }

    public List<Waveform> preferredWaveforms() {
        return preferredWaveforms;
    }

    public List<Duration> durationBias() {
        return durationBias;
    }

    public double reverbAmount() {
        return reverbAmount;
    }

    @Override
    public String toString() {
        return id;
    }
}
