package org.codesonify.midi;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class VariableLengthQuantityTest {

    @Test
    void encodesReferenceValues() {
        assertThat(VariableLengthQuantity.encode(0)).containsExactly(0x00);
        assertThat(VariableLengthQuantity.encode(127)).containsExactly(0x7F);
        assertThat(VariableLengthQuantity.encode(128)).containsExactly(0x81, 0x00);
        assertThat(VariableLengthQuantity.encode(480)).containsExactly(0x83, 0x60);
        assertThat(VariableLengthQuantity.encode(0x3FFF)).containsExactly(0xFF, 0x7F);
        assertThat(VariableLengthQuantity.encode(VariableLengthQuantity.MAX_VALUE))
                .containsExactly(0xFF, 0xFF, 0xFF, 0x7F);
    }

    @Test
    void negativeValuesEncodeAsZero() {
        assertThat(VariableLengthQuantity.encode(-5)).containsExactly(0x00);
    }

    @Test
    void decodesFromAnOffset() {
        byte[] buffer = {0x00, (byte) 0x83, 0x60, 0x7F};

        VariableLengthQuantity.Decoded decoded = VariableLengthQuantity.decode(buffer, 1);

        assertThat(decoded.value()).isEqualTo(480);
        assertThat(decoded.byteCount()).isEqualTo(2);
    }

    @Test
    void rejectsTruncatedAndOverlongQuantities() {
        assertThatThrownBy(() -> VariableLengthQuantity.decode(new byte[]{(byte) 0x81}, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Truncated");
        byte[] overlong = {(byte) 0x81, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x00};
        assertThatThrownBy(() -> VariableLengthQuantity.decode(overlong, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds four bytes");
    }
}
