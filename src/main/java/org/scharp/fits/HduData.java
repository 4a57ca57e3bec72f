///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.io.OutputStream;

/**
 * The data segment of an HDU, as it is serialized after the header.
 */
public interface HduData {

    /**
     * Gets the number of bytes that {@link #writeTo} writes. This does not include the padding to the next block.
     *
     * @return The size of the data, in bytes.
     */
    long sizeInBytes();

    /**
     * Gets the byte with which the final data block is filled after the data.
     *
     * @return The padding byte.
     */
    byte paddingByte();

    /**
     * Writes the data without padding.
     *
     * @param outputStream
     *     The stream to write to. This is not closed.
     *
     * @throws IOException
     *     if the data couldn't be written.
     */
    void writeTo(OutputStream outputStream) throws IOException;
}
