///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link WriteUtil}. */
public class WriteUtilTest {

    /** Tests for {@link WriteUtil#write2} */
    @Test
    void testWrite2() {
        final byte[] data = new byte[9];

        // Simple write, tests endianness.
        assertEquals(2, WriteUtil.write2(data, 0, (short) 0xDDCC));
        assertArrayEquals(new byte[] { (byte) 0xDD, (byte) 0xCC, 0, 0, 0, 0, 0, 0, 0 }, data);

        // Can write 0
        WriteUtil.write2(data, 0, (short) 0);
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 0, 0 }, data);

        // Non-zero offset
        WriteUtil.write2(data, 2, (short) 0x0102);
        assertArrayEquals(new byte[] { 0, 0, 1, 2, 0, 0, 0, 0, 0 }, data);

        // offset is beyond end
        Exception exception = assertThrows(
            ArrayIndexOutOfBoundsException.class,
            () -> WriteUtil.write2(data, 10, (short) 0xFFFF));
        assertEquals("Index 10 out of bounds for length 9", exception.getMessage());
        assertArrayEquals(new byte[] { 0, 0, 1, 2, 0, 0, 0, 0, 0 }, data, "data changed on error");

        // null array
        assertThrows(NullPointerException.class, () -> WriteUtil.write2(null, 0, (short) 0xFFFF));
    }

    /** Tests for {@link WriteUtil#write4} */
    @Test
    void testWrite4() {
        final byte[] data = new byte[9];

        // Simple write, tests endianness.
        assertEquals(4, WriteUtil.write4(data, 0, 0xAABBCCDD));
        assertArrayEquals(new byte[] { (byte) 0xAA, (byte) 0xBB, (byte) 0xCC, (byte) 0xDD, 0, 0, 0, 0, 0 }, data);

        // Can write 0
        WriteUtil.write4(data, 0, 0);
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 0, 0 }, data);

        // Non-zero offset
        WriteUtil.write4(data, 4, 0x12345678);
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0x12, 0x34, 0x56, 0x78, 0 }, data);

        // IEEE 754 single precision 1.0
        WriteUtil.write4(data, 0, Float.floatToRawIntBits(1.0f));
        assertArrayEquals(new byte[] { 0x3F, (byte) 0x80, 0, 0, 0x12, 0x34, 0x56, 0x78, 0 }, data);
    }

    /** Tests for {@link WriteUtil#write8} */
    @Test
    void testWrite8() {
        final byte[] data = new byte[9];

        // Simple write, tests endianness.
        assertEquals(8, WriteUtil.write8(data, 1, 0x0102030405060708L));
        assertArrayEquals(new byte[] { 0, 1, 2, 3, 4, 5, 6, 7, 8 }, data);

        // negative number
        WriteUtil.write8(data, 0, -2L);
        assertArrayEquals(
            new byte[] { -1, -1, -1, -1, -1, -1, -1, -2, 8 },
            data);

        // IEEE 754 double precision -2.0
        WriteUtil.write8(data, 0, Double.doubleToRawLongBits(-2.0));
        assertArrayEquals(new byte[] { (byte) 0xC0, 0, 0, 0, 0, 0, 0, 0, 8 }, data);
    }

    /** Tests for {@link WriteUtil#writeAscii} */
    @Test
    void testWriteAscii() {
        final byte[] data = new byte[12];

        // padded with spaces
        WriteUtil.writeAscii(data, 2, "END", 8);
        assertArrayEquals(new byte[] { 0, 0, 'E', 'N', 'D', ' ', ' ', ' ', ' ', ' ', 0, 0 }, data);

        // exact length
        WriteUtil.writeAscii(data, 0, "XTENSION", 8);
        assertArrayEquals(new byte[] { 'X', 'T', 'E', 'N', 'S', 'I', 'O', 'N', ' ', ' ', 0, 0 }, data);

        // empty string is all padding
        WriteUtil.writeAscii(data, 8, "", 4);
        assertArrayEquals(new byte[] { 'X', 'T', 'E', 'N', 'S', 'I', 'O', 'N', ' ', ' ', ' ', ' ' }, data);
    }
}
