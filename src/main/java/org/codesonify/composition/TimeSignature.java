package org.codesonify.composition;

/**
 * A time signature such as 4/4.
 *
 * @param numerator Beats per bar.
 * @param denominator Note value of one beat; a power of two.
 */
public record TimeSignature(int numerator, int denominator) {

    /** Common time. */
    public static final TimeSignature COMMON = new TimeSignature(4, 4);
}
