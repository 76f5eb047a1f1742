package org.codesonify.music;

import com.google.gson.annotations.SerializedName;

/**
 * The twelve pitch classes, in chromatic order starting at C.
 */
public enum NoteName {
    @SerializedName("C") C("C"),
    @SerializedName("C#") C_SHARP("C#"),
    @SerializedName("D") D("D"),
    @SerializedName("D#") D_SHARP("D#"),
    @SerializedName("E") E("E"),
    @SerializedName("F") F("F"),
    @SerializedName("F#") F_SHARP("F#"),
    @SerializedName("G") G("G"),
    @SerializedName("G#") G_SHARP("G#"),
    @SerializedName("A") A("A"),
    @SerializedName("A#") A_SHARP("A#"),
    @SerializedName("B") B("B");

    private static final NoteName[] CHROMATIC = values();

    private final String symbol;

    NoteName(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the pitch class for a semitone index. Indices outside 0..11 wrap around.
     * @param semitone The semitone offset from C.
     * @return The pitch class.
     */
    public static NoteName fromSemitone(int semitone) {
        return CHROMATIC[Math.floorMod(semitone, 12)];
    }

    /** @return The semitone offset from C, 0..11. */
    public int semitone() {
        return ordinal();
    }

    /** @return The conventional spelling, e.g. {@code "F#"}. */
    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
