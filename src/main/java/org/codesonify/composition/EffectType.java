package org.codesonify.composition;

import com.google.gson.annotations.SerializedName;

/**
 * Audio effects a player may put on a track.
 */
public enum EffectType {
    @SerializedName("reverb") REVERB,
    @SerializedName("delay") DELAY,
    @SerializedName("distortion") DISTORTION,
    @SerializedName("chorus") CHORUS,
    @SerializedName("filter") FILTER
}
