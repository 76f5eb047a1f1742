package org.codesonify.visualization;

/**
 * One note as a point in a frequency plot.
 *
 * @param frequency The pitch in Hz.
 * @param amplitude The note velocity, 0..1.
 * @param time The start time in seconds.
 */
public record FrequencyBand(double frequency, double amplitude, double time) {}
