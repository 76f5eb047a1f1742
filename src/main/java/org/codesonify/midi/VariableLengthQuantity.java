package org.codesonify.midi;

/**
 * The variable-length quantity used for MIDI delta times: big-endian groups of 7 bits, with the
 * continuation bit {@code 0x80} set on every byte except the last.
 * <p>
 * Values up to {@code 0x0FFFFFFF} fit into the four bytes the file format allows.
 */
public final class VariableLengthQuantity {

    /** The largest value the format can represent. */
    public static final int MAX_VALUE = 0x0FFFFFFF;

    private VariableLengthQuantity() {}

    /**
     * A decoded quantity.
     *
     * @param value The value.
     * @param byteCount The number of bytes it occupied.
     */
    public record Decoded(int value, int byteCount) {}

    /**
     * Encodes a value. Negative values encode as 0.
     * @param value The value.
     * @return 1 to 5 bytes, most significant group first.
     */
    public static byte[] encode(int value) {
        int remaining = Math.max(0, value);
        byte[] buffer = new byte[5];
        int position = buffer.length - 1;
        buffer[position] = (byte) (remaining & 0x7F);
        remaining >>>= 7;
        while (remaining > 0) {
            buffer[--position] = (byte) ((remaining & 0x7F) | 0x80);
            remaining >>>= 7;
        }
        byte[] result = new byte[buffer.length - position];
        System.arraycopy(buffer, position, result, 0, result.length);
        return result;
    }

    /**
     * Decodes a quantity starting at an offset.
     *
     * @param bytes The buffer.
     * @param offset Index of the first byte of the quantity.
     * @return The value and its length.
     * @throws IllegalArgumentException if the buffer ends inside the quantity or it is longer than four bytes.
     */
    public static Decoded decode(byte[] bytes, int offset) {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            if (offset + i >= bytes.length) {
                throw new IllegalArgumentException("Truncated variable-length quantity at offset " + offset);
            }
            int b = bytes[offset + i] & 0xFF;
            value = (value << 7) | (b & 0x7F);
            if ((b & 0x80) == 0) {
                return new Decoded(value, i + 1);
            }
        }
        throw new IllegalArgumentException("Variable-length quantity at offset " + offset + " exceeds four bytes");
    }
}
