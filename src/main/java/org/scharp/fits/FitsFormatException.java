///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * Signals that a byte stream does not have the structure of a FITS file, for example because its length is not a
 * whole number of blocks or because a header has no END record.
 */
public class FitsFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code FitsFormatException}.
     *
     * @param message
     *     A description of the structural problem.
     */
    public FitsFormatException(String message) {
        super(message);
    }

    /**
     * Creates a new {@code FitsFormatException} caused by another exception.
     *
     * @param message
     *     A description of the structural problem.
     * @param cause
     *     The exception that revealed the problem.
     */
    public FitsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
