///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link MathUtil}. */
public class MathUtilTest {
    @Test
    public void testAlign() {
        // already aligned
        assertEquals(0, MathUtil.align(0, 2880));
        assertEquals(2880, MathUtil.align(2880, 2880));
        assertEquals(5760, MathUtil.align(5760, 2880));

        // rounded up
        assertEquals(2880, MathUtil.align(1, 2880));
        assertEquals(2880, MathUtil.align(2879, 2880));
        assertEquals(5760, MathUtil.align(2881, 2880));

        // record alignment
        assertEquals(160, MathUtil.align(81, 80));

        // large values
        assertEquals(2880L * 1_000_000_000L, MathUtil.align(2880L * 1_000_000_000L - 1, 2880));
    }
}
