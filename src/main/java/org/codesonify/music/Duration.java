package org.codesonify.music;

import com.google.gson.annotations.SerializedName;

/**
 * Symbolic note durations.
 * <p>
 * Each duration knows its length in seconds at the 120 BPM reference tempo and its length in ticks
 * at a resolution of {@value #TICKS_PER_QUARTER} ticks per quarter note.
 */
public enum Duration {
    @SerializedName("16n") SIXTEENTH("16n", 0.125, 120),
    @SerializedName("8n") EIGHTH("8n", 0.25, 240),
    @SerializedName("8n.") DOTTED_EIGHTH("8n.", 0.375, 360),
    @SerializedName("4n") QUARTER("4n", 0.5, 480),
    @SerializedName("4n.") DOTTED_QUARTER("4n.", 0.75, 720),
    @SerializedName("2n") HALF("2n", 1.0, 960),
    @SerializedName("2n.") DOTTED_HALF("2n.", 1.5, 1440),
    @SerializedName("1n") WHOLE("1n", 2.0, 1920);

    /** Tick resolution the tick counts are expressed in. */
    public static final int TICKS_PER_QUARTER = 480;

    private final String symbol;
    private final double referenceSeconds;
    private final int ticks;

    Duration(String symbol, double referenceSeconds, int ticks) {
        this.symbol = symbol;
        this.referenceSeconds = referenceSeconds;
        this.ticks = ticks;
    }

    public String symbol() {
        return symbol;
    }

    /** @return The length in seconds at 120 BPM. */
    public double referenceSeconds() {
        return referenceSeconds;
    }

    /** @return The length in ticks at {@value #TICKS_PER_QUARTER} ticks per quarter note. */
    public int ticks() {
        return ticks;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
