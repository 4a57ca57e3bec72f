///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.math.BigDecimal;

/**
 * The kinds of data element that this library knows how to describe in a FITS header.
 * <p>
 * FITS only has signed integers (except for 8-bit integers, which are unsigned) and IEEE 754 floating point numbers.
 * The other integer kinds are persisted by offsetting their range with the {@code BZERO} keyword.
 * </p>
 */
public enum ElementType {

    /** A signed 8-bit integer, persisted as an unsigned byte with {@code BZERO = -128}. */
    INT8(1, 8, "-128", 'I'),

    /** An unsigned 8-bit integer. This is FITS's native byte type. */
    UINT8(1, 8, "0.0", 'I'),

    /** A signed 16-bit integer. */
    INT16(2, 16, "0.0", 'I'),

    /** An unsigned 16-bit integer, persisted as a signed integer with {@code BZERO = 32768}. */
    UINT16(2, 16, "32768", 'I'),

    /** A signed 32-bit integer. */
    INT32(4, 32, "0.0", 'I'),

    /** An unsigned 32-bit integer, persisted as a signed integer with {@code BZERO = 2147483648}. */
    UINT32(4, 32, "2147483648", 'I'),

    /** A signed 64-bit integer. */
    INT64(8, 64, "0.0", 'I'),

    /** An unsigned 64-bit integer, persisted as a signed integer with {@code BZERO = 9223372036854775808}. */
    UINT64(8, 64, "9223372036854775808", 'I'),

    /** An IEEE 754 single precision number. */
    FLOAT32(4, -32, "0.0", 'E'),

    /** An IEEE 754 double precision number. */
    FLOAT64(8, -64, "0.0", 'D'),

    /** A boolean, which can only be stored in a table as the integer 1 or 0. */
    BOOLEAN(0, 0, null, 'I'),

    /** A single character. */
    CHARACTER(0, 0, null, 'A'),

    /** A string of characters. */
    STRING(0, 0, null, 'A'),

    /** Anything else. This can only be stored in a table by its {@code toString()} rendering. */
    OTHER(0, 0, null, 'X');

    private final int sizeInBytes;
    private final int bitpix;
    private final String bzero;
    private final char tableTypeCode;

    ElementType(int sizeInBytes, int bitpix, String bzero, char tableTypeCode) {
        assert bitpix == 0 || Math.abs(bitpix) == 8 * sizeInBytes : "inconsistent bitpix for " + name();
        this.sizeInBytes = sizeInBytes;
        this.bitpix = bitpix;
        this.bzero = bzero;
        this.tableTypeCode = tableTypeCode;
    }

    /**
     * Gets whether elements of this type are real numbers which can be stored in an image.
     *
     * @return {@code true}, if this type is numeric; {@code false}, otherwise.
     */
    public boolean isNumeric() {
        return bitpix != 0;
    }

    /**
     * Gets whether elements of this type are floating point numbers.
     *
     * @return {@code true}, if this is {@link #FLOAT32} or {@link #FLOAT64}; {@code false}, otherwise.
     */
    public boolean isFloatingPoint() {
        return bitpix < 0;
    }

    /**
     * Gets the value of the {@code BITPIX} keyword that describes this type: the number of bits in an element,
     * negated for floating point types.
     *
     * @return The BITPIX value.
     *
     * @throws IllegalStateException
     *     if this type is not numeric.
     */
    public int bitpix() {
        checkNumeric();
        return bitpix;
    }

    /**
     * Gets the size of a single element of this type, in bytes.
     *
     * @return The size of an element.
     *
     * @throws IllegalStateException
     *     if this type is not numeric.
     */
    public int sizeInBytes() {
        checkNumeric();
        return sizeInBytes;
    }

    /**
     * Gets the value of the {@code BZERO} keyword, rendered as it appears in a header.
     *
     * @return The zero offset, such as {@code "0.0"} or {@code "32768"}.
     *
     * @throws IllegalStateException
     *     if this type is not numeric.
     */
    public String bzero() {
        checkNumeric();
        return bzero;
    }

    /**
     * Gets the FITS ASCII table type code for a column whose cells are of this type.
     *
     * @return {@code 'I'}, {@code 'E'}, {@code 'D'}, {@code 'A'}, or {@code 'X'}.
     */
    public char tableTypeCode() {
        return tableTypeCode;
    }

    private void checkNumeric() {
        if (!isNumeric()) {
            throw new IllegalStateException(name() + " is not a numeric element type");
        }
    }

    /**
     * Determines the element type of a table cell from its Java class.
     *
     * @param value
     *     The cell value.
     *
     * @return The element type. This is {@link #OTHER} if the class isn't recognized.
     */
    static ElementType forValue(Object value) {
        if (value instanceof Byte) {
            return INT8;
        } else if (value instanceof Short) {
            return INT16;
        } else if (value instanceof Integer) {
            return INT32;
        } else if (value instanceof Long) {
            return INT64;
        } else if (value instanceof Float) {
            return FLOAT32;
        } else if (value instanceof Double) {
            return FLOAT64;
        } else if (value instanceof Boolean) {
            return BOOLEAN;
        } else if (value instanceof Character) {
            return CHARACTER;
        } else if (value instanceof String) {
            return STRING;
        } else {
            return OTHER;
        }
    }

    /**
     * Determines the numeric element type that is described by a header's {@code BITPIX} and {@code BZERO}.
     *
     * @param bitpix
     *     The value of the {@code BITPIX} keyword.
     * @param bzero
     *     The value of the {@code BZERO} keyword, or zero if the header has none.
     *
     * @return The element type.
     *
     * @throws FitsFormatException
     *     if {@code bitpix} is not a value permitted by the FITS standard.
     */
    static ElementType forBitpix(int bitpix, BigDecimal bzero) throws FitsFormatException {
        ElementType signedType = null;
        for (ElementType type : values()) {
            if (type.isNumeric() && type.bitpix == bitpix) {
                if (new BigDecimal(type.bzero).compareTo(bzero) == 0) {
                    return type;
                }
                if (signedType == null) {
                    signedType = type;
                }
            }
        }
        if (signedType == null) {
            throw new FitsFormatException("BITPIX value " + bitpix + " is not permitted");
        }

        // An unrecognized BZERO is a linear scaling of the stored value, not an unsigned type.
        return bitpix == 8 ? UINT8 : signedType;
    }
}
