///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The data of an ASCII table HDU: a sequence of fixed-width rows of ASCII text.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class AsciiTableData implements HduData {

    private final List<String> rows;
    private final int rowLength;

    /**
     * Creates table data from its rows.
     *
     * @param rows
     *     The rows. Each must have exactly {@code rowLength} ASCII characters.
     * @param rowLength
     *     The length of each row.
     */
    AsciiTableData(List<String> rows, int rowLength) {
        assert rows.stream().allMatch(row -> row.length() == rowLength) : "row of wrong length";
        this.rows = List.copyOf(rows);
        this.rowLength = rowLength;
    }

    /**
     * Gets the rows of this table.
     *
     * @return An unmodifiable list of rows.
     */
    public List<String> rows() {
        return rows;
    }

    /**
     * Gets the number of characters in each row (the table's {@code NAXIS1}).
     *
     * @return The row length.
     */
    public int rowLength() {
        return rowLength;
    }

    @Override
    public long sizeInBytes() {
        return (long) rows.size() * rowLength;
    }

    @Override
    public byte paddingByte() {
        return ' ';
    }

    @Override
    public void writeTo(OutputStream outputStream) throws IOException {
        for (String row : rows) {
            outputStream.write(row.getBytes(StandardCharsets.US_ASCII));
        }
    }
}
