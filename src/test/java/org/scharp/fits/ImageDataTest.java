///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ImageData}. */
public class ImageDataTest {

    private static byte[] serialize(ImageData data) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        data.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    @Test
    void testOf() {
        ImageData data = ImageData.of(new short[] { 1, 2, 3, 4, 5, 6 }, 3, 2);
        assertEquals(ElementType.INT16, data.type());
        assertArrayEquals(new int[] { 3, 2 }, data.axes());
        assertEquals(6, data.elementCount());
        assertEquals(12, data.sizeInBytes());
        assertTrue(data.hasData());
        assertEquals((short) 4, data.get(3));
        assertEquals("INT16[3, 2]", data.toString());

        // no axes means one-dimensional
        data = ImageData.of(new float[] { 1.5f, 2.5f });
        assertEquals(ElementType.FLOAT32, data.type());
        assertArrayEquals(new int[] { 2 }, data.axes());

        assertEquals(ElementType.INT8, ImageData.of(new byte[1]).type());
        assertEquals(ElementType.INT32, ImageData.of(new int[1]).type());
        assertEquals(ElementType.INT64, ImageData.of(new long[1]).type());
        assertEquals(ElementType.FLOAT64, ImageData.of(new double[1]).type());
        assertEquals(ElementType.BOOLEAN, ImageData.of(new boolean[1]).type());
        assertEquals(ElementType.CHARACTER, ImageData.of(new char[1]).type());
        assertEquals(ElementType.STRING, ImageData.of(new String[] { "a" }).type());
    }

    @Test
    void testUnsigned() {
        assertEquals(ElementType.UINT8, ImageData.unsigned(new byte[] { -1 }).type());
        assertEquals(ElementType.UINT16, ImageData.unsigned(new short[] { -1 }).type());
        assertEquals(ElementType.UINT32, ImageData.unsigned(new int[] { -1 }).type());
        assertEquals(ElementType.UINT64, ImageData.unsigned(new long[] { -1 }).type());

        // elements are widened to their unsigned value
        assertEquals(255, ImageData.unsigned(new byte[] { -1 }).get(0));
        assertEquals(65535, ImageData.unsigned(new short[] { -1 }).get(0));
        assertEquals(4294967295L, ImageData.unsigned(new int[] { -1 }).get(0));
        assertEquals(new BigInteger("18446744073709551615"), ImageData.unsigned(new long[] { -1 }).get(0));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ImageData.unsigned(new float[1]));
        assertEquals("unsigned data must be given as an integer array, not float[]", exception.getMessage());
    }

    @Test
    void testArrayIsCopied() {
        int[] array = { 1, 2, 3 };
        ImageData data = ImageData.of(array);
        array[0] = 100;
        assertEquals(1, data.get(0));

        int[] copy = (int[]) data.toArray();
        copy[1] = 200;
        assertEquals(2, data.get(1));

        int[] axes = data.axes();
        axes[0] = 7;
        assertArrayEquals(new int[] { 3 }, data.axes());
    }

    @Test
    void testNoData() throws IOException {
        assertFalse(ImageData.NONE.hasData());
        assertNull(ImageData.NONE.type());
        assertEquals(0, ImageData.NONE.axes().length);
        assertEquals(0, ImageData.NONE.elementCount());
        assertEquals(0, ImageData.NONE.sizeInBytes());
        assertNull(ImageData.NONE.toArray());
        assertEquals("NONE", ImageData.NONE.toString());
        assertEquals(0, serialize(ImageData.NONE).length);

        // An empty one-dimensional array is treated as no data.
        ImageData empty = ImageData.of(new float[0]);
        assertFalse(empty.hasData());
        assertEquals(0, empty.sizeInBytes());

        // An empty two-dimensional array still has axes.
        assertTrue(ImageData.of(new float[0], 0, 5).hasData());
    }

    @Test
    void testBadAxes() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> ImageData.of(new int[6], 4, 2));
        assertEquals("axes [4, 2] describe 8 elements but the array has 6", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ImageData.of(new int[0], -1));
        assertEquals("axis 1 must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ImageData.of(new int[1], new int[1000]));
        assertEquals("an image must not have more than 999 axes", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ImageData.of("not an array"));
        assertEquals("unsupported array type: String", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> ImageData.of(null));
        assertEquals("array must not be null", exception.getMessage());
    }

    @Test
    void testWriteSignedIntegers() throws IOException {
        // signed bytes are offset to unsigned
        assertArrayEquals(
            new byte[] { (byte) 0x80, 0x00, (byte) 0xFF },
            serialize(ImageData.of(new byte[] { 0, -128, 127 })));

        assertArrayEquals(
            new byte[] { 0x00, 0x01, (byte) 0xFF, (byte) 0xFE },
            serialize(ImageData.of(new short[] { 1, -2 })));

        assertArrayEquals(
            new byte[] { 0x01, 0x02, 0x03, 0x04 },
            serialize(ImageData.of(new int[] { 0x01020304 })));

        assertArrayEquals(
            new byte[] { 0, 0, 0, 0, 0, 0, 0, 5 },
            serialize(ImageData.of(new long[] { 5 })));
    }

    @Test
    void testWriteUnsignedIntegers() throws IOException {
        // unsigned bytes are written as they are
        assertArrayEquals(new byte[] { (byte) 0xFF, 0 }, serialize(ImageData.unsigned(new byte[] { -1, 0 })));

        // other unsigned types are offset to signed
        assertArrayEquals(
            new byte[] { (byte) 0x80, 0x00, 0x7F, (byte) 0xFF },
            serialize(ImageData.unsigned(new short[] { 0, -1 })));

        assertArrayEquals(
            new byte[] { (byte) 0x80, 0, 0, 0 },
            serialize(ImageData.unsigned(new int[] { 0 })));

        assertArrayEquals(
            new byte[] { 0x7F, -1, -1, -1, -1, -1, -1, -1 },
            serialize(ImageData.unsigned(new long[] { -1 })));
    }

    @Test
    void testWriteFloatingPoint() throws IOException {
        assertArrayEquals(new byte[] { 0x3F, (byte) 0x80, 0, 0 }, serialize(ImageData.of(new float[] { 1.0f })));
        assertArrayEquals(new byte[] { (byte) 0xC0, 0, 0, 0, 0, 0, 0, 0 }, serialize(ImageData.of(new double[] { -2 })));
    }

    @Test
    void testWriteSpansBlocks() throws IOException {
        double[] array = new double[1000];
        array[999] = 1.0;
        byte[] bytes = serialize(ImageData.of(array));

        assertEquals(8000, bytes.length);
        assertEquals(0x3F, bytes[7992]);
        assertEquals((byte) 0xF0, bytes[7993]);
    }

    @Test
    void testWriteNonNumeric() {
        ImageData data = ImageData.of(new boolean[] { true });
        Exception exception = assertThrows(IllegalStateException.class, () -> serialize(data));
        assertEquals("BOOLEAN data cannot be written to an image", exception.getMessage());
    }

    @Test
    void testDecode() throws IOException {
        ImageData[] images = {
            ImageData.of(new byte[] { 0, -128, 127 }),
            ImageData.unsigned(new byte[] { -1, 0, 1 }),
            ImageData.of(new short[] { 1, -2, 3, -4 }, 2, 2),
            ImageData.unsigned(new short[] { 0, -1 }),
            ImageData.of(new int[] { Integer.MIN_VALUE, Integer.MAX_VALUE }),
            ImageData.unsigned(new int[] { 0, -1 }),
            ImageData.of(new long[] { Long.MIN_VALUE, 0, Long.MAX_VALUE }, 3, 1),
            ImageData.unsigned(new long[] { 0, -1 }),
            ImageData.of(new float[] { 1.5f, Float.NaN, Float.NEGATIVE_INFINITY }),
            ImageData.of(new double[] { Math.PI, -0.0 }),
        };
        for (ImageData image : images) {
            ImageData decoded = ImageData.decode(image.type(), image.axes(), serialize(image));
            assertEquals(image, decoded, image.toString());
            assertEquals(image.hashCode(), decoded.hashCode(), image.toString());
        }
    }

    @Test
    void testEquals() {
        ImageData data = ImageData.of(new int[] { 1, 2, 3, 4 }, 2, 2);

        assertEquals(data, ImageData.of(new int[] { 1, 2, 3, 4 }, 2, 2));
        assertNotEquals(data, ImageData.of(new int[] { 1, 2, 3, 4 }, 4, 1));
        assertNotEquals(data, ImageData.of(new int[] { 1, 2, 3, 5 }, 2, 2));
        assertNotEquals(data, ImageData.unsigned(new int[] { 1, 2, 3, 4 }, 2, 2));
        assertNotEquals(data, ImageData.NONE);
        assertNotEquals(data, null);
    }
}
