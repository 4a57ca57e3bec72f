///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Utility methods for writing data to a byte array */
final class WriteUtil {

    // private constructor to prevent anyone from instantiating the class.
    private WriteUtil() {
    }

    /**
     * Writes a two byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write2(byte[] data, int offset, short number) {
        // FITS is always serialized as big-endian
        data[offset] = (byte) (number >> 8);
        data[offset + 1] = (byte) number;
        return 2;
    }

    /**
     * Writes a four byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write4(byte[] data, int offset, int number) {
        data[offset] = (byte) (number >> 24);
        data[offset + 1] = (byte) (number >> 16);
        data[offset + 2] = (byte) (number >> 8);
        data[offset + 3] = (byte) number;
        return 4;
    }

    /**
     * Writes an eight byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write8(byte[] data, int offset, long number) {
        data[offset] = (byte) (number >> 56);
        data[offset + 1] = (byte) (number >> 48);
        data[offset + 2] = (byte) (number >> 40);
        data[offset + 3] = (byte) (number >> 32);
        data[offset + 4] = (byte) (number >> 24);
        data[offset + 5] = (byte) (number >> 16);
        data[offset + 6] = (byte) (number >> 8);
        data[offset + 7] = (byte) number;
        return 8;
    }

    /**
     * Writes an ASCII string to a binary array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset of the array to which the first byte of the string is written.
     * @param string
     *     The string to write.  This must be entirely composed of ASCII characters.
     * @param length
     *     The number of bytes to write. If the length of {@code string} is less than this, then the bytes after the end
     *     of the string are set to an SPACE character (' ').
     */
    static void writeAscii(byte[] data, int offset, String string, int length) {
        assert string.matches("^\\p{ASCII}*$");
        assert string.length() <= length;

        byte[] ascii = string.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(ascii, 0, data, offset, ascii.length);

        // pad the rest
        Arrays.fill(data, offset + ascii.length, offset + length, (byte) ' ');
    }
}
