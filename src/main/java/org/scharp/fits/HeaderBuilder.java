///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the HDUs of a FITS file: the header records that describe some data, paired with that data.
 * <p>
 * There is one method for each kind of HDU. Each throws as soon as it finds that its input cannot be described by
 * a valid header.
 * </p>
 */
public final class HeaderBuilder {

    private static final Logger log = LoggerFactory.getLogger(HeaderBuilder.class);

    /** The most columns that an ASCII table may have. */
    public static final int MAX_COLUMNS = 999;

    static final String PRIMARY_COMMENT = "   Primary FITS HDU    / http://fits.gsfc.nasa.gov/iaufwg";
    static final String EXTENSION_COMMENT = "   Extended FITS HDU   / http://fits.gsfc.nasa.gov/iaufwg";

    // private constructor to prevent anyone from instantiating the class.
    private HeaderBuilder() {
    }

    private static void checkNumeric(ImageData data) {
        if (!data.type().isNumeric()) {
            throw new IllegalArgumentException("image data must be real numbers, not " + data.type());
        }
    }

    private static void addAxes(Header.Builder builder, int[] axes) {
        builder.add(HeaderRecord.integer("NAXIS", axes.length, "number of data axes"));
        for (int i = 0; i < axes.length; i++) {
            int axis = i + 1;
            builder.add(HeaderRecord.integer("NAXIS" + axis, axes[i], "length of data axis " + axis));
        }
    }

    private static void addScaling(Header.Builder builder, ElementType type) {
        builder.add(HeaderRecord.numeric("BZERO", type.bzero(), "offset data range to that of unsigned integer"));
        builder.add(HeaderRecord.numeric("BSCALE", "1.0", "default scaling factor"));
    }

    /**
     * Builds a primary HDU.
     *
     * @param data
     *     The primary data array, or {@link ImageData#NONE} for a primary HDU without data.
     *
     * @return The HDU, whose data is {@code data}.
     *
     * @throws NullPointerException
     *     if {@code data} is {@code null}.
     * @throws IllegalArgumentException
     *     if the elements of {@code data} are not real numbers.
     */
    public static Hdu primary(ImageData data) {
        ArgumentUtil.checkNotNull(data, "data");

        Header.Builder builder = Header.builder();
        builder.add(HeaderRecord.logical("SIMPLE", true, "file does conform to FITS standard"));
        if (data.hasData()) {
            checkNumeric(data);
            builder.add(HeaderRecord.integer("BITPIX", data.type().bitpix(), "number of bits per data pixel"));
            addAxes(builder, data.axes());
            addScaling(builder, data.type());
        } else {
            builder.add(HeaderRecord.integer("NAXIS", 0, "number of data axes"));
        }
        builder.add(HeaderRecord.logical("EXTEND", true, "FITS dataset may contain extensions"));
        builder.add(HeaderRecord.comment(PRIMARY_COMMENT));

        return new Hdu(HduType.PRIMARY, builder.seal(), data.hasData() ? data : ImageData.NONE);
    }

    /**
     * Builds an image extension HDU.
     *
     * @param data
     *     The image. This must have at least one axis and at least one element.
     *
     * @return The HDU, whose data is {@code data}.
     *
     * @throws NullPointerException
     *     if {@code data} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code data} is empty or if its elements are not real numbers.
     */
    public static Hdu image(ImageData data) {
        ArgumentUtil.checkNotNull(data, "data");
        if (!data.hasData() || data.elementCount() == 0) {
            throw new IllegalArgumentException("an image extension must have data");
        }
        checkNumeric(data);

        Header.Builder builder = Header.builder();
        builder.add(HeaderRecord.string("XTENSION", HduType.IMAGE.extensionName(), "FITS standard extension"));
        builder.add(HeaderRecord.integer("BITPIX", data.type().bitpix(), "number of bits per data pixel"));
        addAxes(builder, data.axes());
        builder.add(HeaderRecord.integer("PCOUNT", 0, "number of bytes in supplemental data area"));
        builder.add(HeaderRecord.integer("GCOUNT", 1, "data blocks contain single image"));
        addScaling(builder, data.type());
        builder.add(HeaderRecord.comment(EXTENSION_COMMENT));

        return new Hdu(HduType.IMAGE, builder.seal(), data);
    }

    /**
     * Builds an ASCII table extension HDU.
     * <p>
     * Each column is given a width of one more than its longest rendered cell, so that adjacent fields are separated
     * by at least one space.  The format of each column is inferred with {@link TableTypeInference}.
     * </p>
     * <p>
     * A table may have at most 999 columns.  If more are given, only the first 999 are written and a warning is
     * logged.
     * </p>
     *
     * @param columns
     *     The columns of the table, from left to right.  All columns must have the same number of rows.
     *
     * @return The HDU, whose data is an {@link AsciiTableData}.
     *
     * @throws NullPointerException
     *     if {@code columns} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if there are no columns, if the columns have no rows, if a column has a different number of rows than the
     *     first column, or if a column has a character that is not 7-bit ASCII.
     */
    public static Hdu table(List<TableColumn> columns) {
        ArgumentUtil.checkNotNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("a table must have at least one column");
        }
        for (TableColumn column : columns) {
            ArgumentUtil.checkNotNull(column, "column");
        }
        if (MAX_COLUMNS < columns.size()) {
            log.warn("a table has at most {} columns; truncating table of {} columns", MAX_COLUMNS, columns.size());
            columns = columns.subList(0, MAX_COLUMNS);
        }

        final int totalColumns = columns.size();
        final int totalRows = columns.get(0).size();
        if (totalRows == 0) {
            throw new IllegalArgumentException("a table must have at least one row");
        }
        for (int i = 1; i < totalColumns; i++) {
            TableColumn column = columns.get(i);
            if (column.size() != totalRows) {
                throw new IllegalArgumentException(
                    "columns are not of equal length: column " + (i + 1) + " (" + columnName(column, i) + ") has " +
                        column.size() + " rows but column 1 has " + totalRows);
            }
        }
        for (int i = 0; i < totalColumns; i++) {
            checkAscii(columns.get(i), i);
        }

        // Lay out the rows.
        int[] widths = new int[totalColumns];
        int[] fieldStarts = new int[totalColumns];
        int rowLength = 0;
        for (int i = 0; i < totalColumns; i++) {
            int maxLength = 0;
            for (Object value : columns.get(i).values()) {
                maxLength = Math.max(maxLength, TableColumn.render(value).length());
            }
            widths[i] = maxLength + 1;
            fieldStarts[i] = rowLength + 1; // TBCOL is 1-based
            rowLength += widths[i];
        }

        List<String> rows = new ArrayList<>(totalRows);
        StringBuilder row = new StringBuilder(rowLength);
        for (int j = 0; j < totalRows; j++) {
            row.setLength(0);
            for (int i = 0; i < totalColumns; i++) {
                String cell = TableColumn.render(columns.get(i).values().get(j));
                row.append(cell, 0, Math.min(cell.length(), widths[i]));
                row.append(" ".repeat(widths[i] - Math.min(cell.length(), widths[i])));
            }
            rows.add(row.toString());
        }

        List<TableFormat> formats = TableTypeInference.inferFormats(columns);

        Header.Builder builder = Header.builder();
        builder.add(HeaderRecord.string("XTENSION", HduType.TABLE.extensionName(), "FITS standard extension"));
        builder.add(HeaderRecord.integer("BITPIX", 8, "number of bits per data pixel"));
        builder.add(HeaderRecord.integer("NAXIS", 2, "number of data axes"));
        builder.add(HeaderRecord.integer("NAXIS1", rowLength, "number of bytes/row"));
        builder.add(HeaderRecord.integer("NAXIS2", totalRows, "number of rows"));
        builder.add(HeaderRecord.integer("PCOUNT", 0, "number of bytes in supplemental data area"));
        builder.add(HeaderRecord.integer("GCOUNT", 1, "data blocks contain single table"));
        builder.add(HeaderRecord.integer("TFIELDS", totalColumns, "number of data fields (columns)"));
        builder.add(HeaderRecord.integer("COLSEP", 1, "number of spaces in column separator"));
        for (int i = 0; i < totalColumns; i++) {
            String keyword = "TTYPE" + (i + 1);
            builder.add(HeaderRecord.string(keyword, columnName(columns.get(i), i), "header of column " + (i + 1)));
        }
        for (int i = 0; i < totalColumns; i++) {
            String keyword = "TBCOL" + (i + 1);
            builder.add(HeaderRecord.integer(keyword, fieldStarts[i], "pointer to column " + (i + 1)));
        }
        for (int i = 0; i < totalColumns; i++) {
            String keyword = "TFORM" + (i + 1);
            builder.add(HeaderRecord.string(keyword, formats.get(i).toString(), "data type of column " + (i + 1)));
        }
        for (int i = 0; i < totalColumns; i++) {
            String keyword = "TDISP" + (i + 1);
            builder.add(HeaderRecord.string(keyword, formats.get(i).toString(), "data type of column " + (i + 1)));
        }
        builder.add(HeaderRecord.comment(EXTENSION_COMMENT));

        return new Hdu(HduType.TABLE, builder.seal(), new AsciiTableData(rows, rowLength));
    }

    private static String columnName(TableColumn column, int index) {
        return column.name() != null ? column.name() : "HEAD" + (index + 1);
    }

    private static void checkAscii(TableColumn column, int index) {
        for (Object value : column.values()) {
            String text = TableColumn.render(value);
            for (int k = 0; k < text.length(); k++) {
                if (0x7F < text.charAt(k)) {
                    throw new IllegalArgumentException(
                        "column " + (index + 1) + " (" + columnName(column, index) + ") contains a non-ASCII " +
                            "character");
                }
            }
        }
    }
}
