package org.codesonify.music;

import com.google.gson.annotations.SerializedName;

/**
 * The voices notes are routed to. Each becomes its own track.
 */
public enum Instrument {
    /** Functions and main logic. */
    @SerializedName("melody") MELODY("melody"),
    /** Variables and declarations. */
    @SerializedName("bass") BASS("bass"),
    /** Conditionals and branches. */
    @SerializedName("harmony") HARMONY("harmony"),
    /** Loops and repetition. */
    @SerializedName("percussion") PERCUSSION("percussion"),
    /** Comments, whitespace and structure. */
    @SerializedName("ambient") AMBIENT("ambient"),
    /** Errors and warnings. */
    @SerializedName("dissonance") DISSONANCE("dissonance");

    private final String id;

    Instrument(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
