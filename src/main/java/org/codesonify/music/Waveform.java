package org.codesonify.music;

import com.google.gson.annotations.SerializedName;

/**
 * Oscillator shape suggested to a synthesizer playing a track.
 */
public enum Waveform {
    @SerializedName("sine") SINE,
    @SerializedName("square") SQUARE,
    @SerializedName("sawtooth") SAWTOOTH,
    @SerializedName("triangle") TRIANGLE
}
