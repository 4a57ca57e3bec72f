///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes the smallest number greater than or equal to {@code number} that is a multiple of
     * {@code alignmentSize}.
     *
     * @param number
     *     The number to align.
     * @param alignmentSize
     *     The desired alignment.
     *
     * @return An aligned number.
     */
    static long align(long number, long alignmentSize) {
        long excess = number % alignmentSize;
        return excess == 0 ? number : number + alignmentSize - excess;
    }
}
