package org.codesonify.music;

import com.google.gson.annotations.SerializedName;

/**
 * Scales as semitone intervals above the root.
 */
public enum ScaleType {
    @SerializedName("major") MAJOR("major", 0, 2, 4, 5, 7, 9, 11),
    @SerializedName("minor") MINOR("minor", 0, 2, 3, 5, 7, 8, 10),
    @SerializedName("pentatonic") PENTATONIC("pentatonic", 0, 2, 4, 7, 9),
    @SerializedName("blues") BLUES("blues", 0, 3, 5, 6, 7, 10),
    @SerializedName("chromatic") CHROMATIC("chromatic", 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11),
    @SerializedName("dorian") DORIAN("dorian", 0, 2, 3, 5, 7, 9, 10),
    @SerializedName("mixolydian") MIXOLYDIAN("mixolydian", 0, 2, 4, 5, 7, 9, 10),
    @SerializedName("lydian") LYDIAN("lydian", 0, 2, 4, 6, 7, 9, 11);

    private final String id;
    private final int[] intervals;

    ScaleType(String id, int... intervals) {
        this.id = id;
        this.intervals = intervals;
    }

    /** @return The number of degrees in the scale. */
    public int size() {
        return intervals.length;
    }

    /**
     * Returns the interval of a scale degree. Degrees wrap around the scale size.
     * @param degree The zero-based degree.
     * @return The semitone interval above the root.
     */
    public int interval(int degree) {
        return intervals[Math.floorMod(degree, intervals.length)];
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
