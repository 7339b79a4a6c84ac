package net.grammex.util.match;

import java.nio.ByteOrder;
import net.grammex.api.match.BinaryLayout;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LayoutsTest {

    @Test
    void shouldHonorByteOrder() {
        byte[] data = { 0x12, 0x34 };
        assertEquals(Short.valueOf((short) 0x1234),
                     Layouts.INT16_BE.decode(data));
        assertEquals(Short.valueOf((short) 0x3412),
                     Layouts.INT16_LE.decode(data));
        assertEquals(Integer.valueOf(0x3412),
                     Layouts.uint16(ByteOrder.LITTLE_ENDIAN).decode(data));
    }

    @Test
    void shouldDecodeUnsignedValues() {
        assertEquals(Integer.valueOf(255),
                     Layouts.UINT8.decode(new byte[] { (byte) 0xFF }));
        assertEquals(Integer.valueOf(0xFFFE), Layouts.UINT16_BE.decode(
            new byte[] { (byte) 0xFF, (byte) 0xFE }));
        assertEquals(Byte.valueOf((byte) -1),
                     Layouts.INT8.decode(new byte[] { (byte) 0xFF }));
    }

    @Test
    void shouldEncodeInLayoutOrder() {
        assertArrayEquals(new byte[] { 4, 3, 2, 1 },
                          Layouts.INT32_LE.encode(0x01020304));
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 1, 0 },
                          Layouts.INT64_BE.encode(256L));
        assertEquals(Float.valueOf(1.5f), Layouts.FLOAT32_BE.decode(
            Layouts.FLOAT32_BE.encode(1.5f)));
    }

    @Test
    void shouldDescribeLayouts() {
        BinaryLayout<Double> layout = Layouts.float64(ByteOrder.BIG_ENDIAN);
        assertEquals("float64be", layout.toString());
        assertEquals(8, layout.getWidth());
        assertEquals("uint8", Layouts.UINT8.toString());
    }

    @Test
    void shouldRejectWrongWidth() {
        assertThrows(IllegalArgumentException.class,
                     () -> Layouts.INT32_BE.decode(new byte[3]));
        assertThrows(NullPointerException.class,
                     () -> Layouts.INT8.encode(null));
    }

}
