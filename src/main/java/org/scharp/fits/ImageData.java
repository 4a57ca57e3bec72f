///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Array;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * An n-dimensional array of numbers, as stored in a primary or image HDU.
 * <p>
 * The elements are held in a flat Java array in FITS order: the first axis ({@code NAXIS1}) varies fastest.  For a
 * two-dimensional image with {@code axes = {width, height}}, the element at column {@code x} and row {@code y} is at
 * index {@code x + width * y}.
 * </p>
 * <p>
 * Unsigned integers are given as the Java primitive of the same width holding the unsigned bit pattern. For
 * example, the unsigned 16-bit value 65535 is given as the {@code short} value -1.
 * </p>
 * <p>
 * Instances of this class are immutable; the array given to a factory method is copied.
 * </p>
 */
public final class ImageData implements HduData {

    /** The "no data" sentinel for a primary HDU which only has a header. */
    public static final ImageData NONE = new ImageData();

    private final ElementType type;
    private final int[] axes;
    private final Object elements;

    // constructor for NONE
    private ImageData() {
        this.type = null;
        this.axes = new int[0];
        this.elements = null;
    }

    private ImageData(ElementType type, Object elements, int[] axes) {
        int length = Array.getLength(elements);
        int[] effectiveAxes = axes.length == 0 ? new int[] { length } : axes.clone();

        long product = 1;
        for (int i = 0; i < effectiveAxes.length; i++) {
            ArgumentUtil.checkNotNegative(effectiveAxes[i], "axis " + (i + 1));
            product *= effectiveAxes[i];
        }
        if (999 < effectiveAxes.length) {
            throw new IllegalArgumentException("an image must not have more than 999 axes");
        }
        if (product != length) {
            throw new IllegalArgumentException(
                "axes " + Arrays.toString(effectiveAxes) + " describe " + product + " elements but the array has " +
                    length);
        }

        this.type = type;
        this.axes = effectiveAxes;
        this.elements = elements;
    }

    /**
     * Creates image data from a Java array whose component type determines the element type: {@code byte[]} is
     * {@link ElementType#INT8}, {@code short[]} is {@link ElementType#INT16}, {@code int[]} is
     * {@link ElementType#INT32}, {@code long[]} is {@link ElementType#INT64}, {@code float[]} is
     * {@link ElementType#FLOAT32}, and {@code double[]} is {@link ElementType#FLOAT64}.
     * <p>
     * Arrays of {@code boolean}, {@code char} and {@code String} are accepted too, but they are not numeric, so the
     * header builders reject them.
     * </p>
     *
     * @param array
     *     The elements, with the first axis varying fastest.
     * @param axes
     *     The length of each axis, starting with {@code NAXIS1}.  If no axes are given, the array is treated as
     *     one-dimensional.
     *
     * @return The image data.
     *
     * @throws NullPointerException
     *     if {@code array} or {@code axes} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code array} is not an array of a supported type, if an axis is negative, or if the axes don't
     *     describe the number of elements in {@code array}.
     */
    public static ImageData of(Object array, int... axes) {
        ArgumentUtil.checkNotNull(array, "array");
        ArgumentUtil.checkNotNull(axes, "axes");

        final ElementType type;
        if (array instanceof byte[]) {
            type = ElementType.INT8;
        } else if (array instanceof short[]) {
            type = ElementType.INT16;
        } else if (array instanceof int[]) {
            type = ElementType.INT32;
        } else if (array instanceof long[]) {
            type = ElementType.INT64;
        } else if (array instanceof float[]) {
            type = ElementType.FLOAT32;
        } else if (array instanceof double[]) {
            type = ElementType.FLOAT64;
        } else if (array instanceof boolean[]) {
            type = ElementType.BOOLEAN;
        } else if (array instanceof char[]) {
            type = ElementType.CHARACTER;
        } else if (array instanceof String[]) {
            type = ElementType.STRING;
        } else {
            throw new IllegalArgumentException("unsupported array type: " + array.getClass().getSimpleName());
        }
        return new ImageData(type, copyOf(array), axes);
    }

    /**
     * Creates image data of unsigned integers from a Java integer array holding the unsigned bit patterns:
     * {@code byte[]} is {@link ElementType#UINT8}, {@code short[]} is {@link ElementType#UINT16}, {@code int[]} is
     * {@link ElementType#UINT32}, and {@code long[]} is {@link ElementType#UINT64}.
     *
     * @param array
     *     The elements, with the first axis varying fastest.
     * @param axes
     *     The length of each axis, starting with {@code NAXIS1}.  If no axes are given, the array is treated as
     *     one-dimensional.
     *
     * @return The image data.
     *
     * @throws NullPointerException
     *     if {@code array} or {@code axes} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code array} is not an integer array, if an axis is negative, or if the axes don't describe the number
     *     of elements in {@code array}.
     */
    public static ImageData unsigned(Object array, int... axes) {
        ArgumentUtil.checkNotNull(array, "array");
        ArgumentUtil.checkNotNull(axes, "axes");

        final ElementType type;
        if (array instanceof byte[]) {
            type = ElementType.UINT8;
        } else if (array instanceof short[]) {
            type = ElementType.UINT16;
        } else if (array instanceof int[]) {
            type = ElementType.UINT32;
        } else if (array instanceof long[]) {
            type = ElementType.UINT64;
        } else {
            throw new IllegalArgumentException(
                "unsigned data must be given as an integer array, not " + array.getClass().getSimpleName());
        }
        return new ImageData(type, copyOf(array), axes);
    }

    private static Object copyOf(Object array) {
        int length = Array.getLength(array);
        Object copy = Array.newInstance(array.getClass().getComponentType(), length);
        System.arraycopy(array, 0, copy, 0, length);
        return copy;
    }

    /**
     * Gets whether this holds any data.  {@link #NONE} and a one-dimensional array with no elements hold no data;
     * their primary header declares {@code NAXIS = 0}.
     *
     * @return {@code true}, if there is data; {@code false}, otherwise.
     */
    public boolean hasData() {
        return type != null && !(axes.length == 1 && axes[0] == 0);
    }

    /**
     * Gets the type of the elements.
     *
     * @return The element type, or {@code null} for {@link #NONE}.
     */
    public ElementType type() {
        return type;
    }

    /**
     * Gets the length of each axis, starting with {@code NAXIS1}.
     *
     * @return A copy of the axis lengths.  This is empty for {@link #NONE}.
     */
    public int[] axes() {
        return axes.clone();
    }

    /**
     * Gets the total number of elements.
     *
     * @return The number of elements.
     */
    public int elementCount() {
        return elements == null ? 0 : Array.getLength(elements);
    }

    /**
     * Gets an element.  Unsigned types are widened so that the returned number has the unsigned value: a
     * {@link ElementType#UINT8} or {@link ElementType#UINT16} element is returned as an {@code Integer}, a
     * {@link ElementType#UINT32} element as a {@code Long}, and a {@link ElementType#UINT64} element as a
     * {@code BigInteger}.
     *
     * @param index
     *     The index of the element in FITS order.
     *
     * @return The element.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code index} is out of range.
     */
    public Object get(int index) {
        Objects.checkIndex(index, elementCount());
        switch (type) {
        case UINT8:
            return Byte.toUnsignedInt(((byte[]) elements)[index]);
        case UINT16:
            return Short.toUnsignedInt(((short[]) elements)[index]);
        case UINT32:
            return Integer.toUnsignedLong(((int[]) elements)[index]);
        case UINT64:
            return new BigInteger(Long.toUnsignedString(((long[]) elements)[index]));
        default:
            return Array.get(elements, index);
        }
    }

    /**
     * Gets a copy of the elements as the primitive array from which this was created.
     *
     * @return A copy of the elements, or {@code null} for {@link #NONE}.
     */
    public Object toArray() {
        return elements == null ? null : copyOf(elements);
    }

    @Override
    public long sizeInBytes() {
        return hasData() ? (long) elementCount() * type.sizeInBytes() : 0;
    }

    @Override
    public byte paddingByte() {
        return 0;
    }

    /**
     * Writes the elements in big-endian order.  Unsigned types are offset by {@code BZERO} so that they are stored as
     * signed integers, and signed bytes are offset so that they are stored as unsigned bytes.
     *
     * @param outputStream
     *     The stream to write to. This is not closed.
     *
     * @throws IOException
     *     if the data couldn't be written.
     */
    @Override
    public void writeTo(OutputStream outputStream) throws IOException {
        if (!hasData()) {
            return;
        }

        // Buffer one block at a time.  Every element size divides the block size.
        final byte[] buffer = new byte[BlockAddressing.BLOCK_SIZE];
        int offset = 0;
        final int total = elementCount();
        for (int i = 0; i < total; i++) {
            switch (type) {
            case INT8:
                buffer[offset++] = (byte) (((byte[]) elements)[i] ^ 0x80);
                break;
            case UINT8:
                buffer[offset++] = ((byte[]) elements)[i];
                break;
            case INT16:
                offset += WriteUtil.write2(buffer, offset, ((short[]) elements)[i]);
                break;
            case UINT16:
                offset += WriteUtil.write2(buffer, offset, (short) (((short[]) elements)[i] ^ 0x8000));
                break;
            case INT32:
                offset += WriteUtil.write4(buffer, offset, ((int[]) elements)[i]);
                break;
            case UINT32:
                offset += WriteUtil.write4(buffer, offset, ((int[]) elements)[i] ^ Integer.MIN_VALUE);
                break;
            case INT64:
                offset += WriteUtil.write8(buffer, offset, ((long[]) elements)[i]);
                break;
            case UINT64:
                offset += WriteUtil.write8(buffer, offset, ((long[]) elements)[i] ^ Long.MIN_VALUE);
                break;
            case FLOAT32:
                offset += WriteUtil.write4(buffer, offset, Float.floatToRawIntBits(((float[]) elements)[i]));
                break;
            case FLOAT64:
                offset += WriteUtil.write8(buffer, offset, Double.doubleToRawLongBits(((double[]) elements)[i]));
                break;
            default:
                throw new IllegalStateException(type + " data cannot be written to an image");
            }

            if (offset == buffer.length) {
                outputStream.write(buffer);
                offset = 0;
            }
        }
        outputStream.write(buffer, 0, offset);
    }

    /**
     * Decodes image data that was written by {@link #writeTo}.
     *
     * @param type
     *     The numeric element type.
     * @param axes
     *     The length of each axis.
     * @param bytes
     *     The serialized elements without padding.
     *
     * @return The image data.
     */
    static ImageData decode(ElementType type, int[] axes, byte[] bytes) {
        assert type.isNumeric() : type + " is not numeric";

        final ByteBuffer buffer = ByteBuffer.wrap(bytes); // big-endian by default
        final int total = bytes.length / type.sizeInBytes();
        final Object elements;
        switch (type) {
        case INT8:
        case UINT8: {
            byte[] array = new byte[total];
            buffer.get(array);
            if (type == ElementType.INT8) {
                for (int i = 0; i < total; i++) {
                    array[i] ^= (byte) 0x80;
                }
            }
            elements = array;
            break;
        }
        case INT16:
        case UINT16: {
            short[] array = new short[total];
            buffer.asShortBuffer().get(array);
            if (type == ElementType.UINT16) {
                for (int i = 0; i < total; i++) {
                    array[i] ^= (short) 0x8000;
                }
            }
            elements = array;
            break;
        }
        case INT32:
        case UINT32: {
            int[] array = new int[total];
            buffer.asIntBuffer().get(array);
            if (type == ElementType.UINT32) {
                for (int i = 0; i < total; i++) {
                    array[i] ^= Integer.MIN_VALUE;
                }
            }
            elements = array;
            break;
        }
        case INT64:
        case UINT64: {
            long[] array = new long[total];
            buffer.asLongBuffer().get(array);
            if (type == ElementType.UINT64) {
                for (int i = 0; i < total; i++) {
                    array[i] ^= Long.MIN_VALUE;
                }
            }
            elements = array;
            break;
        }
        case FLOAT32: {
            float[] array = new float[total];
            buffer.asFloatBuffer().get(array);
            elements = array;
            break;
        }
        case FLOAT64: {
            double[] array = new double[total];
            buffer.asDoubleBuffer().get(array);
            elements = array;
            break;
        }
        default:
            throw new IllegalArgumentException(type + " is not numeric");
        }

        return new ImageData(type, elements, axes);
    }

    /**
     * Gets a hash code for this image data.
     *
     * @return this image data's hash code
     */
    @Override
    public int hashCode() {
        return Objects.hash(type, Arrays.hashCode(axes), elementCount());
    }

    /**
     * Determines if this image data is equal to another object.
     * <p>
     * Two image data are equal if they have the same element type, the same axes, and the same elements.
     * </p>
     *
     * @param other
     *     The object with which to compare this image data
     *
     * @return {@code true}, if this image data is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImageData otherData)) {
            return false;
        }

        return type == otherData.type &&
            Arrays.equals(axes, otherData.axes) &&
            Objects.deepEquals(elements, otherData.elements);
    }

    @Override
    public String toString() {
        return hasData() ? type + Arrays.toString(axes) : "NONE";
    }
}
